package com.conveyal.wtt;

import com.conveyal.wtt.model.Entity;
import com.conveyal.wtt.model.Rake;
import com.conveyal.wtt.model.RakeLink;
import com.conveyal.wtt.model.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Gives every valid rake-link its own {@link Rake}. The first service on the path that asks for an AC rake makes the
 * rake AC, and the first service of the path sets the car count, falling back on the default when its header states
 * none. Rakes are numbered from one, in link declaration order.
 */
public class RakeAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(RakeAssigner.class);

    /**
     * @return the number of rakes created.
     */
    public int assignRakes (List<RakeLink> links) {
        int rakeId = 0;
        int acRakes = 0;
        for (RakeLink link : links) {
            if (!link.isValid()) continue;
            // Make rake ID one-based so that it reads the same as the printed rake numbers.
            rakeId += 1;
            link.rake = rakeFor(rakeId, link.getServicePath());
            if (link.rake.ac) acRakes += 1;
        }
        LOG.info("Assigned {} rakes, {} of them AC.", rakeId, acRakes);
        return rakeId;
    }

    /**
     * Single forward scan over the path, stopping at the first service that asks for an AC rake.
     */
    public static Rake rakeFor (int rakeId, List<Service> path) {
        Rake rake = new Rake(rakeId);
        if (path.isEmpty()) return rake;
        rake.carCount = carCountOf(path.get(0));
        for (Service service : path) {
            if (service.needsAcRake) {
                rake.ac = true;
                break;
            }
        }
        return rake;
    }

    /** @return the car count a service's header asks for, or the default when the header does not say. */
    private static int carCountOf (Service service) {
        return service.carCount == Entity.INT_MISSING ? Rake.DEFAULT_CAR_COUNT : service.carCount;
    }

}
