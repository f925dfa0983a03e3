package io.clubone.reminder.mapping;

import org.springframework.context.ApplicationEvent;

/**
 * Published once at boot; listeners contribute their mappings through
 * {@link #register(ActionMapping)}.
 */
public class MappingRegisterEvent extends ApplicationEvent {

	private static final long serialVersionUID = 1L;

	private final transient ActionMappingRegistry registry;

	public MappingRegisterEvent(ActionMappingRegistry registry) {
		super(registry);
		this.registry = registry;
	}

	public MappingRegisterEvent register(ActionMapping mapping) {
		registry.add(mapping);
		return this;
	}
}
