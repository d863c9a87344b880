package com.backlinkqc.collector;

import com.backlinkqc.preflight.PublisherProfile;

import java.util.Optional;

public interface PublisherProfileSource {

    Optional<PublisherProfile> find(String domain);
}
