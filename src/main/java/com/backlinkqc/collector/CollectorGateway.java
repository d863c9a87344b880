package com.backlinkqc.collector;

import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.order.Order;
import com.backlinkqc.portfolio.AnchorPortfolio;
import com.backlinkqc.portfolio.AnchorType;
import com.backlinkqc.preflight.PreflightMatrix;
import com.backlinkqc.preflight.PublisherProfile;
import com.backlinkqc.preflight.SerpSignal;
import com.backlinkqc.trust.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single entry point to the external collaborators. Every call is bounded by
 * the configured timeout; a timeout or a failing collaborator surfaces as
 * {@code DEPENDENCY_UNAVAILABLE}. The core never substitutes defaults for a
 * missing profile, portfolio or registry.
 */
public class CollectorGateway {

    private static final Logger log = LoggerFactory.getLogger(CollectorGateway.class);

    private final PublisherProfileSource profiles;
    private final AnchorPortfolioSource portfolios;
    private final SerpSignalSource serp;
    private final TrustRegistrySource registry;
    private final ArticleDraftSource drafts;
    private final MdcPropagatingExecutor executor;
    private final CollectorProperties properties;

    public CollectorGateway(PublisherProfileSource profiles,
                            AnchorPortfolioSource portfolios,
                            SerpSignalSource serp,
                            TrustRegistrySource registry,
                            ArticleDraftSource drafts,
                            MdcPropagatingExecutor executor,
                            CollectorProperties properties) {
        this.profiles = profiles;
        this.portfolios = portfolios;
        this.serp = serp;
        this.registry = registry;
        this.drafts = drafts;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * @return the profile, or null when the publisher is unknown
     */
    public PublisherProfile publisherProfile(String domain) {
        return call("publisher_profile", domain, () -> profiles.find(domain)).orElse(null);
    }

    public AnchorPortfolio anchorPortfolio(String targetDomain) {
        return call("anchor_portfolio", targetDomain, () -> portfolios.get(targetDomain));
    }

    public AnchorPortfolio recordPlacement(String targetDomain, AnchorType type) {
        return call("anchor_portfolio", targetDomain, () -> portfolios.recordPlacement(targetDomain, type));
    }

    public SerpSignal serpSignal(String query) {
        return call("serp_signal", query, () -> serp.fetch(query, properties.locale()));
    }

    public TrustRegistry trustRegistry() {
        return call("trust_registry", "current", registry::current);
    }

    public String draft(Order order, PreflightMatrix matrix) {
        return call("article_draft", order.orderId(), () -> drafts.draft(order, matrix));
    }

    private <T> T call(String dependency, String key, Supplier<T> supplier) {
        Future<T> future = executor.submit(supplier::get);
        try {
            T result = future.get(properties.timeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw PlanningException.dependencyUnavailable(dependency, key, null);
            }
            return result;
        } catch (TimeoutException ex) {
            // interrupts the collaborator so the pool thread is handed back
            future.cancel(true);
            log.warn("Collector {} timed out after {}ms for key={}", dependency, properties.timeoutMs(), key);
            throw PlanningException.dependencyUnavailable(dependency, key, ex);
        } catch (ExecutionException ex) {
            log.warn("Collector {} failed for key={}: {}", dependency, key, ex.getCause().getMessage());
            throw PlanningException.dependencyUnavailable(dependency, key, ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw PlanningException.dependencyUnavailable(dependency, key, ex);
        }
    }
}
