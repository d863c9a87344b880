package com.backlinkqc.trust;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TrustConfiguration {

    /** Swedish and English disclaimer phrasing for every regulated tag. */
    @Bean
    public DisclaimerCatalog disclaimerCatalog() {
        return DisclaimerCatalog.standard();
    }

    @Bean
    public TrustComplianceChecker trustComplianceChecker(DisclaimerCatalog catalog) {
        return new TrustComplianceChecker(catalog);
    }
}
