package com.backlinkqc.collector;

import com.backlinkqc.order.Tone;
import com.backlinkqc.preflight.Perspective;
import com.backlinkqc.preflight.PublisherProfile;
import com.backlinkqc.trust.DomainNames;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPublisherProfileSource implements PublisherProfileSource {

    private final ConcurrentHashMap<String, PublisherProfile> profiles = new ConcurrentHashMap<>();

    public InMemoryPublisherProfileSource(List<PublisherProfile> seed) {
        seed.forEach(this::put);
    }

    public static InMemoryPublisherProfileSource seeded() {
        return new InMemoryPublisherProfileSource(List.of(
            new PublisherProfile("slaktforskning.example.se", "genealogy", Tone.INFORMATIVE, Perspective.THIRD_PERSON),
            new PublisherProfile("hushallsekonomi.example.se", "finance", Tone.PROFESSIONAL, Perspective.SECOND_PERSON),
            new PublisherProfile("halsa.example.se", "health", Tone.CONVERSATIONAL, Perspective.SECOND_PERSON),
            new PublisherProfile("teknikbloggen.example.se", "technology", Tone.INFORMATIVE, Perspective.FIRST_PERSON)
        ));
    }

    public void put(PublisherProfile profile) {
        profiles.put(DomainNames.normalize(profile.domain()), profile);
    }

    @Override
    public Optional<PublisherProfile> find(String domain) {
        return Optional.ofNullable(profiles.get(DomainNames.normalize(domain)));
    }
}
