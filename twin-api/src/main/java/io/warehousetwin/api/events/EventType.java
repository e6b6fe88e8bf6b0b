package io.warehousetwin.api.events;

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

/**
 * Kinds of warehouse events. Each kind defines the payload keys it carries.
 */
public enum EventType {
    /** A new order entered the system. Payload: the order's fields. */
    ORDER_CREATED,
    /** Order status moved. Payload: {@code order_id}, {@code status} (ERP events use {@code new_status}). */
    ORDER_STATUS_CHANGED,
    /** On-hand quantity changed. Payload: {@code sku}, {@code change}, {@code new_quantity}. */
    INVENTORY_UPDATED,
    /** A worker was granted to an order. Recorded only with detailed tracing. */
    WORKER_ASSIGNED,
    /** A worker went back to the pool. Recorded only with detailed tracing. */
    WORKER_RELEASED,
    /** A forklift was granted to an order line. Recorded only with detailed tracing. */
    RESOURCE_ALLOCATED,
    /** A forklift went back to the pool. Recorded only with detailed tracing. */
    RESOURCE_RELEASED,
    /** A line could not be picked for lack of stock and was marked short. */
    PICK_SHORTED,
    /** Inventory drift exceeded the configured threshold. Payload: {@code drift}, {@code threshold}. */
    CALIBRATION_TRIGGER
}
