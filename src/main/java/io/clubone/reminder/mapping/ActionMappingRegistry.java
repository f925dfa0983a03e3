package io.clubone.reminder.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the reminder mappings known to the application. The mappings are
 * collected by publishing a {@link MappingRegisterEvent} when the context is
 * refreshed. A mapping instance may register again on a later refresh; a
 * different mapping claiming a taken id is rejected.
 */
@Component
@Slf4j
public class ActionMappingRegistry {

	private final ApplicationEventPublisher eventPublisher;

	private final Map<Integer, ActionMapping> mappings = new ConcurrentSkipListMap<>();

	public ActionMappingRegistry(ApplicationEventPublisher eventPublisher) {
		this.eventPublisher = eventPublisher;
	}

	@EventListener
	public void onContextRefreshed(ContextRefreshedEvent event) {
		collect();
	}

	/**
	 * Ask every listener to register its mappings.
	 */
	public void collect() {
		eventPublisher.publishEvent(new MappingRegisterEvent(this));
		log.info("Registered {} action mapping(s): {}", mappings.size(), mappings.keySet());
	}

	void add(ActionMapping mapping) {
		ActionMapping existing = mappings.putIfAbsent(mapping.getId(), mapping);
		if (existing != null && existing != mapping) {
			throw new IllegalStateException("Action mapping id " + mapping.getId() + " is already registered by "
					+ existing.getClass().getSimpleName());
		}
	}

	public Optional<ActionMapping> getMapping(int id) {
		return Optional.ofNullable(mappings.get(id));
	}

	public List<ActionMapping> getMappings() {
		return Collections.unmodifiableList(new ArrayList<>(mappings.values()));
	}
}
