package io.mdsistemas.invoicing.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;

import io.mdsistemas.invoicing.baseobject.InvoicingDataAccessException;
import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandlerController {

	private final static String EXCEPTION_NAME = "inside handleOnRunTimeExceptions method, exception name is :";

	private final static String ERROR_PROPERTY = "error";

	@ExceptionHandler(value = RuntimeException.class)
	public ProblemDetail handleOnRunTimeExceptions(RuntimeException exception) {
		ProblemDetail problemDetail;
		if (exception instanceof ResourceNotFoundException notFound) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
			problemDetail.setProperty("messageId", notFound.getReason().getCode());
			log.error(EXCEPTION_NAME + "ResourceNotFoundException and statusCode is {}", 404);
		} else if (exception instanceof NotValidException notValid) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			problemDetail.setProperty("messageId", notValid.getReason().getCode());
			log.error(EXCEPTION_NAME + "NotValidException and statusCode is {}", 400);
		} else if (exception instanceof HttpMessageNotReadableException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			log.error(EXCEPTION_NAME + "HttpMessageNotReadableException and statusCode is {}", 400);
		} else if (exception instanceof MultipartException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			log.error(EXCEPTION_NAME + "MultipartException and statusCode is {}", 400);
		} else if (exception instanceof InvoiceProcessingException processing) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
			problemDetail.setProperty("messageId", processing.getReason().getCode());
			log.error(EXCEPTION_NAME + "InvoiceProcessingException and statusCode is {}", 500, exception);
		} else if (exception instanceof InvoicingDataAccessException dataAccess) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
			problemDetail.setProperty("messageId", dataAccess.getMessageId());
			log.error(EXCEPTION_NAME + "InvoicingDataAccessException and statusCode is {}", 500, exception);
		} else {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
					String.valueOf(exception.getMessage()));
			log.error(EXCEPTION_NAME + "{} and statusCode is {}", exception.getClass().getSimpleName(), 500,
					exception);
		}
		problemDetail.setProperty(ERROR_PROPERTY, exception.getMessage());
		return problemDetail;
	}
}
