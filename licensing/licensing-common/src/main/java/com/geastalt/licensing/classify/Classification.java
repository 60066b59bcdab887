/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.classify;

import com.geastalt.licensing.model.AddressType;

public record Classification(AddressType addressType, ClassificationRule rule) {
}
