package com.backlinkqc.collector;

import com.backlinkqc.preflight.SerpSignal;

public interface SerpSignalSource {

    SerpSignal fetch(String query, String locale);
}
