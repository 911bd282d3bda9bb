package fr.lapetina.orchestrator.infrastructure.balancer;

/**
 * Version routing of one service.
 *
 * @param activeVersion version receiving regular traffic, null while a brand
 *                      new service has no promoted version yet
 * @param canaryVersion version receiving the canary share, null without canary
 * @param canaryWeight  percentage of calls sent to the canary version
 */
public record RoutingTable(String activeVersion, String canaryVersion, int canaryWeight) {

    public RoutingTable {
        if (canaryWeight < 0 || canaryWeight > 100) {
            throw new IllegalArgumentException("Canary weight must be within [0, 100]: " + canaryWeight);
        }
    }

    public static RoutingTable pinned(String activeVersion) {
        return new RoutingTable(activeVersion, null, 0);
    }

    public RoutingTable withCanary(String version, int weight) {
        return new RoutingTable(activeVersion, version, weight);
    }

    public boolean hasCanary() {
        return canaryVersion != null && canaryWeight > 0;
    }

    public boolean isRoutable(String version) {
        return version.equals(activeVersion) || (hasCanary() && version.equals(canaryVersion));
    }
}
