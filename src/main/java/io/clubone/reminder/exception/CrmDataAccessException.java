package io.clubone.reminder.exception;

/**
 * Data-layer failure carrying a message id that callers can map to a friendly
 * message.
 */
public class CrmDataAccessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String messageId;

	private final transient Object[] args;

	public CrmDataAccessException(String errorMessage, String messageId, Object... args) {
		super(errorMessage);
		this.messageId = messageId;
		this.args = args;
	}

	public CrmDataAccessException(String errorMessage, String messageId, Throwable cause, Object... args) {
		super(errorMessage, cause);
		this.messageId = messageId;
		this.args = args;
	}

	public String getMessageId() {
		return messageId;
	}

	public Object[] getArgs() {
		return args;
	}
}
