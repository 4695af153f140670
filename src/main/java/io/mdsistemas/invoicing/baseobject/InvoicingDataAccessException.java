package io.mdsistemas.invoicing.baseobject;

public class InvoicingDataAccessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String errorMessage;

	private final Integer messageId;

	public InvoicingDataAccessException(String errorMessage, Integer messageId) {
		super(errorMessage);
		this.errorMessage = errorMessage;
		this.messageId = messageId;
	}

	public InvoicingDataAccessException(String errorMessage, Integer messageId, Throwable cause) {
		super(errorMessage, cause);
		this.errorMessage = errorMessage;
		this.messageId = messageId;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public Integer getMessageId() {
		return messageId;
	}
}
