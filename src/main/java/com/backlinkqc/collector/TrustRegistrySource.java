package com.backlinkqc.collector;

import com.backlinkqc.trust.TrustRegistry;

public interface TrustRegistrySource {

    /** The current registry snapshot. */
    TrustRegistry current();
}
