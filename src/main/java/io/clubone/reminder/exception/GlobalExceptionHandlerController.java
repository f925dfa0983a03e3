package io.clubone.reminder.exception;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandlerController {

	private static final String EXCEPTION_NAME = "inside handleOnRunTimeExceptions method, exception name is :";

	@ExceptionHandler(value = RuntimeException.class)
	public ProblemDetail handleOnRunTimeExceptions(RuntimeException exception) {
		ProblemDetail problemDetail;
		if (exception instanceof ResourceNotFoundException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
			log.error(EXCEPTION_NAME + "ResourceNotFoundException and statusCode is {}", 404);
		} else if (exception instanceof NotValidException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			log.error(EXCEPTION_NAME + "NotValidException and statusCode is {}", 400);
		} else if (exception instanceof MethodArgumentTypeMismatchException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			log.error(EXCEPTION_NAME + "MethodArgumentTypeMismatchException and statusCode is {}", 400);
		} else if (exception instanceof CrmDataAccessException dataAccessException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, exception.getMessage());
			problemDetail.setProperty("messageId", dataAccessException.getMessageId());
			log.error(EXCEPTION_NAME + "CrmDataAccessException {} and statusCode is {}",
					dataAccessException.getMessageId(), 409);
		} else {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
			log.error(EXCEPTION_NAME + exception.getClass().getSimpleName() + " and statusCode is {}", 500, exception);
		}
		return problemDetail;
	}

	@ResponseStatus(HttpStatus.BAD_REQUEST)
	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidationExceptions(MethodArgumentNotValidException ex) {
		StringBuilder stringBuilder = new StringBuilder();
		for (FieldError error : ex.getBindingResult().getFieldErrors()) {
			stringBuilder.append(error.getField() + " : " + error.getDefaultMessage() + ",");
		}
		for (ObjectError error : ex.getBindingResult().getGlobalErrors()) {
			stringBuilder.append(error.getObjectName() + " : " + error.getDefaultMessage() + ",");
		}
		return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, StringUtils.chop(stringBuilder.toString()));
	}
}
