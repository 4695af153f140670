package io.mdsistemas.invoicing.exception;

public enum InvoicingExceptionMessage {
	FILE_MISSING(10001),
	FILE_UNREADABLE(10002),
	DOCUMENT_RENDER_FAILED(10003),
	INVALID_RECORD(10004),
	RECORD_NOT_FOUND(10005),
	RECORD_PERSIST_FAILED(10006),
	RECORD_READ_FAILED(10007);

	private int code;

	public int getCode() {
		return code;
	}

	private InvoicingExceptionMessage(int code) {
		this.code = code;
	}
}
