package io.clubone.reminder.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class NotValidException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public NotValidException(String msg) {
		super(msg);
	}
}
