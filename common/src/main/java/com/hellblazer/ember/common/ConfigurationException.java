/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.ember.common;

import java.util.List;

/**
 * Thrown when graph, hazard, planner or mission parameters are invalid. Raised only while a run is
 * being set up; it aborts the run before any mission starts.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message the detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Throw if any validation errors were collected.
     *
     * @param what   name of the configuration being validated
     * @param errors collected errors
     */
    public static void throwIfAny(String what, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid " + what + ": " + String.join("; ", errors));
        }
    }
}
