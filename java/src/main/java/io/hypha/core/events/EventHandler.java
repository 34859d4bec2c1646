package io.hypha.core.events;

@FunctionalInterface
public interface EventHandler {

    void onEvent(Object payload) throws Exception;
}
