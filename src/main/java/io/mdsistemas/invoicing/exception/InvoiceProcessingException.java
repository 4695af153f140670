package io.mdsistemas.invoicing.exception;

import lombok.Getter;

/**
 * Aborts a whole processing request: unreadable upload, or a row whose document could not be built.
 */
@Getter
public class InvoiceProcessingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final InvoicingExceptionMessage reason;

	public InvoiceProcessingException(InvoicingExceptionMessage reason, String message) {
		super(message);
		this.reason = reason;
	}

	public InvoiceProcessingException(InvoicingExceptionMessage reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}
}
