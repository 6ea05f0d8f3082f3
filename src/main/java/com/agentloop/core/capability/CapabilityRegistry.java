package com.agentloop.core.capability;

import com.agentloop.core.error.CapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keyed store of callable capabilities, exposed to the loop through {@link CapabilityInvocationPort}.
 * Thread-safe: waves invoke it from several worker threads.
 */
public class CapabilityRegistry implements CapabilityInvocationPort {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private record Registration(CapabilityDescriptor descriptor, CapabilityHandler handler) {
    }

    private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> order = new CopyOnWriteArrayList<>();

    public CapabilityRegistry register(String name, CapabilityKind kind, String description,
                                       CapabilityHandler handler) {
        var registration = new Registration(new CapabilityDescriptor(name, kind, description), handler);
        if (registrations.put(name, registration) == null) {
            order.add(name);
        }
        log.info("Registered capability '{}' [{}]", name, kind);
        return this;
    }

    public Optional<CapabilityDescriptor> lookup(String name) {
        return Optional.ofNullable(registrations.get(name)).map(Registration::descriptor);
    }

    /** Registered capabilities in registration order. */
    public List<CapabilityDescriptor> descriptors() {
        return order.stream().map(name -> registrations.get(name).descriptor()).toList();
    }

    @Override
    public CapabilityResult invoke(String capabilityRef, Map<String, String> arguments, Duration timeout) {
        Registration registration = registrations.get(capabilityRef);
        if (registration == null) {
            throw new CapabilityException(capabilityRef, "Unknown capability '" + capabilityRef + "'");
        }
        log.debug("Invoking {} capability '{}' with {} argument(s)",
                registration.descriptor().kind(), capabilityRef, arguments.size());
        try {
            return CapabilityResult.ok(registration.handler().handle(arguments));
        } catch (CapabilityException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException(capabilityRef, "Capability '" + capabilityRef + "' was interrupted", e);
        } catch (Exception e) {
            throw new CapabilityException(capabilityRef,
                    "Capability '" + capabilityRef + "' failed: " + e.getMessage(), e);
        }
    }
}
