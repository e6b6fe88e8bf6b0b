package io.warehousetwin.api.config;

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

import java.util.Locale;

/**
 * What the picker does when a line asks for more than is on hand.
 *
 * <p>Stock is never driven below zero under either policy.
 */
public enum StockoutPolicy {

    /**
     * The line is marked short and nothing is taken from inventory.
     * The order continues with its remaining lines.
     */
    FAIL_LINE("fail_line"),

    /**
     * The picker waits, still holding its worker, until replenishment makes
     * the full line quantity available. Waiters on one SKU are served FIFO.
     */
    BLOCK_UNTIL_REPLENISHED("block_until_replenished");

    private final String label;

    StockoutPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StockoutPolicy fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (StockoutPolicy policy : values()) {
                if (policy.label.equals(normalized) || policy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new ConfigException("Unknown stockout policy: " + label);
    }
}
