/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.histogramdata;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/// Buffer sharing strategy used when a series is copied.
///
/// ## Modes
///
/// | Mode | Property value | Copy cost | Write cost |
/// |------|----------------|-----------|------------|
/// | **COPY_ON_WRITE** | `cow` (default) | O(1), shares the buffer | O(n) the first time a shared buffer is written |
/// | **DEEP_COPY** | `copy` | O(n) | O(1) |
///
/// Both modes produce identical values. The mode is selected once per JVM with the system
/// property {@code -Dhistogramdata.sharing=cow|copy}.
///
/// ```java
/// if (SharingMode.effective() == SharingMode.DEEP_COPY) {
///     // every copy constructor allocates
/// }
/// ```
public enum SharingMode {

    /// Copies share one buffer until one of them is written.
    COPY_ON_WRITE("cow"),

    /// Every copy allocates its own buffer.
    DEEP_COPY("copy");

    /// System property that selects the mode.
    public static final String PROPERTY = "histogramdata.sharing";

    private static final Logger logger = LogManager.getLogger(SharingMode.class);

    private static final SharingMode EFFECTIVE = resolve(System.getProperty(PROPERTY));

    private final String propertyValue;

    SharingMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /// Returns the value of {@link #PROPERTY} that selects this mode.
    public String propertyValue() {
        return propertyValue;
    }

    /// Returns the mode in effect for this JVM.
    public static SharingMode effective() {
        return EFFECTIVE;
    }

    /// Resolves a property value to a mode.
    ///
    /// A null or blank value selects {@link #COPY_ON_WRITE}. Unrecognized values are logged
    /// and also fall back to {@link #COPY_ON_WRITE}.
    ///
    /// @param value the raw property value, possibly null
    /// @return the selected mode
    public static SharingMode resolve(String value) {
        if (value == null || value.isBlank()) {
            logger.debug("No {} property set, using {}", PROPERTY, COPY_ON_WRITE);
            return COPY_ON_WRITE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SharingMode mode : values()) {
            if (mode.propertyValue.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                logger.debug("Using {} from {}={}", mode, PROPERTY, value);
                return mode;
            }
        }
        logger.warn("Unrecognized {} value '{}', expected one of 'cow' or 'copy'; using {}",
            PROPERTY, value, COPY_ON_WRITE);
        return COPY_ON_WRITE;
    }
}
