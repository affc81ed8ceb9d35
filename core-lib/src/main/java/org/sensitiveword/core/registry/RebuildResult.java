package org.sensitiveword.core.registry;

public record RebuildResult(
		Status status,
		String detail
) {
	public enum Status {
		SUCCESS,
		FAILURE
	}

	public static RebuildResult success(String detail) {
		return new RebuildResult(Status.SUCCESS, detail);
	}

	public static RebuildResult failure(String detail) {
		return new RebuildResult(Status.FAILURE, detail);
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}
}
