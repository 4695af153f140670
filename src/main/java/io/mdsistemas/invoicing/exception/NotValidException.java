package io.mdsistemas.invoicing.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import lombok.Data;
import lombok.EqualsAndHashCode;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
@Data
@EqualsAndHashCode(callSuper = false)
public class NotValidException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final InvoicingExceptionMessage reason;

	public NotValidException(InvoicingExceptionMessage reason, String msg) {
		super(msg);
		this.reason = reason;
	}
}
