package io.identityallocator.identity;

import io.identityallocator.labels.Label;
import io.identityallocator.labels.LabelSource;
import io.identityallocator.labels.Labels;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Table of identities that are resolved without any coordination: reserved identities
 * keyed by a single {@code reserved:<name>} label, and well-known identities for
 * infrastructure workloads whose label sets are fixed per cluster.
 */
@Slf4j
public class ReservedIdentities {

    public static final long IDENTITY_UNKNOWN = 0L;
    public static final long IDENTITY_HOST = 1L;
    public static final long IDENTITY_WORLD = 2L;
    public static final long IDENTITY_UNMANAGED = 3L;
    public static final long IDENTITY_HEALTH = 4L;
    public static final long IDENTITY_INIT = 5L;
    public static final long IDENTITY_REMOTE_NODE = 6L;

    public static final long IDENTITY_ETCD_OPERATOR = 100L;
    public static final long IDENTITY_CLUSTER_ETCD = 101L;
    public static final long IDENTITY_KUBE_DNS = 102L;
    public static final long IDENTITY_CORE_DNS = 103L;

    static final String LABEL_NAMESPACE = "io.kubernetes.pod.namespace";
    static final String LABEL_SERVICE_ACCOUNT = "policy.serviceaccount";
    static final String LABEL_CLUSTER = "policy.cluster";
    static final String LABEL_APP = "k8s-app";
    static final String SYSTEM_NAMESPACE = "kube-system";

    private final Map<String, Identity> reservedByName;
    private final Map<Long, Identity> reservedById;

    private volatile Map<String, Identity> wellKnownByKey = Map.of();
    private volatile Map<Long, Identity> wellKnownById = Map.of();

    public ReservedIdentities() {
        Map<String, Identity> byName = new LinkedHashMap<>();
        register(byName, "host", IDENTITY_HOST);
        register(byName, "world", IDENTITY_WORLD);
        register(byName, "unmanaged", IDENTITY_UNMANAGED);
        register(byName, "health", IDENTITY_HEALTH);
        register(byName, "init", IDENTITY_INIT);
        register(byName, "remote-node", IDENTITY_REMOTE_NODE);
        this.reservedByName = Collections.unmodifiableMap(byName);

        Map<Long, Identity> byId = new HashMap<>();
        byName.values().forEach(identity -> byId.put(identity.getId(), identity));
        this.reservedById = Collections.unmodifiableMap(byId);
    }

    private static void register(Map<String, Identity> table, String name, long id) {
        table.put(name, new Identity(id, Labels.of(Label.reserved(name))));
    }

    /**
     * Resolve the well-known identities for the given cluster. Replaces any table from
     * an earlier initialization.
     */
    public void initWellKnownIdentities(String clusterName) {
        Map<String, Identity> byKey = new HashMap<>();
        Map<Long, Identity> byId = new HashMap<>();

        addWellKnown(byKey, byId, IDENTITY_ETCD_OPERATOR, Labels.of(
            k8s("io.cilium/app", "etcd-operator"),
            k8s(LABEL_NAMESPACE, SYSTEM_NAMESPACE),
            k8s(LABEL_SERVICE_ACCOUNT, "etcd-operator"),
            k8s(LABEL_CLUSTER, clusterName)));
        addWellKnown(byKey, byId, IDENTITY_CLUSTER_ETCD, Labels.of(
            k8s("app", "etcd"),
            k8s("etcd_cluster", "identity-etcd"),
            k8s(LABEL_NAMESPACE, SYSTEM_NAMESPACE),
            k8s(LABEL_CLUSTER, clusterName)));
        addWellKnown(byKey, byId, IDENTITY_KUBE_DNS, Labels.of(
            k8s(LABEL_APP, "kube-dns"),
            k8s(LABEL_NAMESPACE, SYSTEM_NAMESPACE),
            k8s(LABEL_SERVICE_ACCOUNT, "kube-dns"),
            k8s(LABEL_CLUSTER, clusterName)));
        addWellKnown(byKey, byId, IDENTITY_CORE_DNS, Labels.of(
            k8s(LABEL_APP, "kube-dns"),
            k8s(LABEL_NAMESPACE, SYSTEM_NAMESPACE),
            k8s(LABEL_SERVICE_ACCOUNT, "coredns"),
            k8s(LABEL_CLUSTER, clusterName)));

        this.wellKnownByKey = Collections.unmodifiableMap(byKey);
        this.wellKnownById = Collections.unmodifiableMap(byId);
        log.info("Initialized {} well-known identities for cluster {}", byId.size(), clusterName);
    }

    private static Label k8s(String key, String value) {
        return new Label(LabelSource.K8S, key, value);
    }

    private static void addWellKnown(Map<String, Identity> byKey, Map<Long, Identity> byId, long id, Labels labels) {
        Identity identity = new Identity(id, labels);
        byKey.put(labels.sortedList(), identity);
        byId.put(id, identity);
    }

    /**
     * The fixed identity for {@code labels}, or null when the set needs allocating.
     * A reserved identity matches only a set consisting of exactly one known
     * {@code reserved:} label; a well-known identity matches only its exact label set.
     */
    public Identity lookupReservedIdentityByLabels(Labels labels) {
        if (labels.size() == 1) {
            Label label = labels.toList().get(0);
            if (label.hasSource(LabelSource.RESERVED)) {
                return reservedByName.get(label.getKey());
            }
        }
        return wellKnownByKey.get(labels.sortedList());
    }

    public Identity lookupById(long id) {
        Identity reserved = reservedById.get(id);
        return reserved != null ? reserved : wellKnownById.get(id);
    }

    public Identity getReserved(String name) {
        return reservedByName.get(name);
    }

    public int wellKnownCount() {
        return wellKnownById.size();
    }
}
