package com.backlinkqc.trust;

public record ProhibitedClaim(String tag, String phrase) {}
