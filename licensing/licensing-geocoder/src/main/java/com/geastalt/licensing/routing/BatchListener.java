/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.routing;

/**
 * Receives batch lifecycle events from the router. Both callbacks run on the routing thread;
 * an exception from either stops dispatch and is rethrown by the router once in-flight work drains.
 */
public interface BatchListener {

    void onDispatch(GeocodeRequestBatch batch);

    void onComplete(BatchOutcome outcome);
}
