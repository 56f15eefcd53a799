package pl.faktulove.ocr.taskqueue.services;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orders owners with claimable work round-robin, starting with the owner after the one
 * served last, so a burst from one owner cannot starve the others.
 */
public class FairOwnerRotation {

    private final AtomicReference<String> lastServedOwner = new AtomicReference<>();

    /**
     * @param owners owners that currently have claimable tasks, in any order
     * @return the distinct owners, beginning after the last served owner and wrapping around
     */
    public List<String> order(Collection<String> owners) {
        TreeSet<String> sorted = new TreeSet<>(owners);
        String last = lastServedOwner.get();
        if (last == null) {
            return new ArrayList<>(sorted);
        }
        List<String> rotation = new ArrayList<>(sorted.size());
        rotation.addAll(sorted.tailSet(last, false));
        rotation.addAll(sorted.headSet(last, true));
        return rotation;
    }

    public void served(String ownerId) {
        lastServedOwner.set(ownerId);
    }

    String lastServed() {
        return lastServedOwner.get();
    }
}
