package io.hypha.core.service;

import io.hypha.core.CallerContext;

import java.util.List;

/**
 * A named callable exposed by a local service.
 */
@FunctionalInterface
public interface ServiceFunction {

    Object invoke(List<Object> args, CallerContext context) throws Exception;
}
