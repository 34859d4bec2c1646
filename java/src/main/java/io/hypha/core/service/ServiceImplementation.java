package io.hypha.core.service;

import java.util.Map;
import java.util.Objects;

/**
 * What backs a registered service: functions living in this process, or a handle reachable
 * through the RPC transport. The two records below are the only implementations.
 */
public interface ServiceImplementation {

    static Local local(Map<String, ServiceFunction> functions) {
        return new Local(functions);
    }

    static Remote remote(String target) {
        return new Remote(target);
    }

    record Local(Map<String, ServiceFunction> functions) implements ServiceImplementation {
        public Local {
            functions = functions == null ? Map.of() : Map.copyOf(functions);
        }
    }

    record Remote(String target) implements ServiceImplementation {
        public Remote {
            Objects.requireNonNull(target, "target");
        }
    }
}
