package io.warehousetwin.calibration;

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

import io.warehousetwin.api.config.ConfigParameter;
import io.warehousetwin.api.model.OrderStatus;

import java.util.Optional;

/// A measured span of an order's history, bounded by two recorded events.
///
/// ```text
///  ORDER_CREATED ──pick──▶ PICKED ──pack──▶ PACKED ──ship──▶ COMPLETED
///       │                                                       ▲
///       └──────────────────────── cycle ────────────────────────┘
/// ```
///
/// `null` as a start status stands for the `ORDER_CREATED` event. Stages that
/// correspond to a timing pair in the configuration name its parameters; the
/// cycle stage is reported for inspection only.
public enum CalibrationStage {
    PICK(null, OrderStatus.PICKED, ConfigParameter.PICK_TIME_MEAN, ConfigParameter.PICK_TIME_STD),
    PACK(OrderStatus.PICKED, OrderStatus.PACKED, ConfigParameter.PACK_TIME_MEAN, ConfigParameter.PACK_TIME_STD),
    SHIP(OrderStatus.PACKED, OrderStatus.COMPLETED, ConfigParameter.SHIP_TIME_MEAN, ConfigParameter.SHIP_TIME_STD),
    CYCLE(null, OrderStatus.COMPLETED, null, null);

    private final OrderStatus from;
    private final OrderStatus to;
    private final ConfigParameter meanParameter;
    private final ConfigParameter stdParameter;

    CalibrationStage(OrderStatus from, OrderStatus to, ConfigParameter meanParameter, ConfigParameter stdParameter) {
        this.from = from;
        this.to = to;
        this.meanParameter = meanParameter;
        this.stdParameter = stdParameter;
    }

    /// @return the starting status, or empty when the stage starts at order creation
    public Optional<OrderStatus> from() {
        return Optional.ofNullable(from);
    }

    public OrderStatus to() {
        return to;
    }

    public Optional<ConfigParameter> meanParameter() {
        return Optional.ofNullable(meanParameter);
    }

    public Optional<ConfigParameter> stdParameter() {
        return Optional.ofNullable(stdParameter);
    }
}
