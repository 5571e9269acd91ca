package com.alterante.speedtest.net;

import com.alterante.speedtest.lifecycle.ResourceLifecycle;
import com.alterante.speedtest.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Probes an ordered list of candidate targets and settles on the first one
 * that validates. Later candidates are never contacted once one succeeds.
 */
public class DiscoveryCascade {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryCascade.class);

    /** Probe and validate one candidate. Returns null if it is unusable. */
    @FunctionalInterface
    public interface CandidateProbe {
        TargetDescriptor probe(URI candidate) throws IOException, ProtocolException;
    }

    private final List<URI> candidates;
    private final CandidateProbe probe;

    public DiscoveryCascade(List<URI> candidates, CandidateProbe probe) {
        this.candidates = List.copyOf(candidates);
        this.probe = probe;
    }

    /**
     * @return the first valid target, or null if none validated or the run is stopping
     */
    public TargetDescriptor discover(ResourceLifecycle lifecycle) {
        int index = 0;
        for (URI candidate : candidates) {
            index++;
            if (lifecycle.shouldStop()) return null;
            try {
                TargetDescriptor target = probe.probe(candidate);
                if (target != null) {
                    log.info("Candidate {}/{} accepted: {} ({})", index, candidates.size(),
                            target.uri(), target.classification() != null ? target.classification().label() : "?");
                    return target;
                }
                log.info("Candidate {}/{} rejected: {}", index, candidates.size(), candidate);
            } catch (IOException | ProtocolException e) {
                log.info("Candidate {}/{} unreachable: {} ({})", index, candidates.size(), candidate, e.getMessage());
            }
        }
        return null;
    }

    public List<URI> candidates() {
        return candidates;
    }
}
