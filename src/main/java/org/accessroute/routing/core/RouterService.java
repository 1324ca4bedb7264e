package org.accessroute.routing.core;

/**
 * Public route service contract.
 *
 * <p>Implementations perform input validation up front and throw reason-coded runtime
 * exceptions for contract failures. Unreachable destinations and exhausted search budgets
 * are reported through {@link RouteResponse#getOutcome()}, never thrown.</p>
 */
public interface RouterService {
    /**
     * Executes one point-to-point route request.
     *
     * @param request client route request.
     * @return route response for the requested origin/destination pair.
     */
    RouteResponse route(RouteRequest request);
}
