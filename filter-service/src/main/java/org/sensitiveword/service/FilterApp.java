package org.sensitiveword.service;

import org.sensitiveword.service.bootstrap.FilterBootstrap;

public class FilterApp {
	public static void main(String[] args) {
		FilterBootstrap.run(args);
	}
}
