package com.netmotif.engine;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a successful check.
 *
 * @param symbols shapes of all bound names, in first-binding order.
 * @param result  shape of the last bare expression statement, if any.
 */
public record CheckResult(Map<String, Shape> symbols, Optional<Shape> result) {
}
