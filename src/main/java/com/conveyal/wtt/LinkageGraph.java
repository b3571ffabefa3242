package com.conveyal.wtt;

import com.conveyal.wtt.error.ErrorStorage;
import com.conveyal.wtt.error.NewWTTError;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.model.Service;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The directed graph over all services (both directions) in which an edge leads from a service to the service it
 * reverses into. Services are held in an arena and referred to by their index in it.
 *
 * Maximal chains are found by starting at every service that has an outgoing edge but no incoming one and following
 * edges forward. A service is visited at most once over the whole traversal, so malformed data (cycles, two services
 * reversing into the same one) truncates chains instead of looping.
 */
public class LinkageGraph {

    private static final Logger LOG = LoggerFactory.getLogger(LinkageGraph.class);

    public static final int NO_SUCCESSOR = -1;

    private final List<Service> services;
    private final Map<String, Integer> indexForId = new HashMap<>();
    private final int[] successor;
    private final int[] incomingEdges;
    private final Set<String> successorIds = new HashSet<>();
    /** Chains keyed on the index of their first service. */
    private final TIntObjectMap<TIntList> chainsByStart = new TIntObjectHashMap<>();
    private final List<TIntList> chains = new ArrayList<>();

    /**
     * @param services every service of the timetable, where services.get(i).index == i.
     */
    public LinkageGraph(List<Service> services, ErrorStorage errorStorage) {
        this.services = Collections.unmodifiableList(services);
        this.successor = new int[services.size()];
        this.incomingEdges = new int[services.size()];
        Arrays.fill(successor, NO_SUCCESSOR);

        for (Service service : services) {
            for (String id : service.getIds()) {
                Integer existing = indexForId.putIfAbsent(id, service.index);
                if (existing != null && existing != service.index) {
                    errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.DUPLICATE_SERVICE_ID)
                        .setBadValue(id)
                        .addInfo("firstColumn", String.valueOf(services.get(existing).column))
                        .addInfo("firstDirection", String.valueOf(services.get(existing).direction)));
                    LOG.warn("Identifier {} is declared by more than one column, using the first one.", id);
                }
            }
        }
        for (Service service : services) {
            if (service.successorId == null) continue;
            successorIds.add(service.successorId);
            Integer target = indexForId.get(service.successorId);
            if (target == null) {
                errorStorage.storeError(NewWTTError.forEntity(service, NewWTTErrorType.SUCCESSOR_UNKNOWN)
                    .setBadValue(service.successorId));
                continue;
            }
            successor[service.index] = target;
            incomingEdges[target] += 1;
        }
        findChains(errorStorage);
    }

    private void findChains (ErrorStorage errorStorage) {
        boolean[] visited = new boolean[services.size()];
        for (int start = 0; start < services.size(); start++) {
            if (visited[start] || hasPredecessor(start) || getSuccessor(start) == NO_SUCCESSOR) continue;
            TIntList chain = new TIntArrayList();
            int current = start;
            while (current != NO_SUCCESSOR && !visited[current]) {
                visited[current] = true;
                chain.add(current);
                current = getSuccessor(current);
            }
            if (current != NO_SUCCESSOR) {
                Service truncated = services.get(chain.get(chain.size() - 1));
                errorStorage.storeError(NewWTTError.forEntity(truncated, NewWTTErrorType.CHAIN_CYCLE)
                    .setBadValue(services.get(current).getId()));
            }
            chains.add(chain);
            chainsByStart.put(start, chain);
        }
        LOG.info("Found {} chains of linked services among {} services.", chains.size(), services.size());
    }

    /** @return the arena index of the service declaring the given identifier, or -1. */
    public int indexOf (String id) {
        Integer index = indexForId.get(id);
        return index == null ? -1 : index;
    }

    public Service getService (int index) {
        return services.get(index);
    }

    public int getSuccessor (int index) {
        return successor[index];
    }

    public boolean hasPredecessor (int index) {
        return incomingEdges[index] > 0;
    }

    /**
     * @return true if some service declares that it reverses into the given identifier, whether or not that
     * identifier exists in the grid.
     */
    public boolean isSuccessorOfAnother (String id) {
        return successorIds.contains(id);
    }

    /**
     * @return the chain starting at the given service, or null if no chain starts there.
     */
    public TIntList chainFrom (int index) {
        return chainsByStart.get(index);
    }

    public List<TIntList> getChains () {
        return Collections.unmodifiableList(chains);
    }

    public List<Service> servicesOf (TIntList chain) {
        List<Service> path = new ArrayList<>(chain.size());
        for (int i = 0; i < chain.size(); i++) {
            path.add(services.get(chain.get(i)));
        }
        return path;
    }

}
