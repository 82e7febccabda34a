package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the opening of the conversation (first {@code preserveFirst} messages) and its most recent part (last
 * {@code preserveLast}), replacing the middle with a single {@link Message#omissionMarker(int) omission marker}.
 * Head and tail are widened to whole tool-call groups.
 *
 * <p>The marker is placed whenever anything lies between head and tail, even if the whole input would fit. If
 * head, tail and marker still exceed the budget, kept groups are dropped oldest-first (head, then tail) and the
 * marker count follows; the marker itself goes last. Markers from an earlier pass are merged into the new one, so
 * a second pass over its own output changes nothing.
 */
public final class SmartTruncationPolicy implements TruncationPolicy {
    private final int preserveFirst;
    private final int preserveLast;
    private final boolean preserveSystem;

    public SmartTruncationPolicy(int preserveFirst, int preserveLast) {
        this(preserveFirst, preserveLast, true);
    }

    public SmartTruncationPolicy(int preserveFirst, int preserveLast, boolean preserveSystem) {
        if (preserveFirst < 0 || preserveLast < 0) {
            throw new IllegalArgumentException("preserveFirst and preserveLast must be >= 0");
        }
        this.preserveFirst = preserveFirst;
        this.preserveLast = preserveLast;
        this.preserveSystem = preserveSystem;
    }

    @Override
    public List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator) {
        var groups = MessageGroups.partition(messages);
        var fixed = new boolean[groups.size()];
        var priorMarker = new boolean[groups.size()];
        int priorOmitted = 0;
        var candidates = new ArrayList<Integer>();
        for (int g = 0; g < groups.size(); g++) {
            var group = groups.get(g);
            if (group.size() == 1 && messages.get(group.start()).isOmissionMarker()) {
                // folded into the single marker of the result
                priorMarker[g] = true;
                priorOmitted += omittedCount(messages.get(group.start()));
                continue;
            }
            fixed[g] = preserveSystem && group.anyMatch(messages, Message::isSystem);
            if (!fixed[g]) {
                candidates.add(g);
            }
        }

        var kept = new boolean[groups.size()];
        for (int g = 0; g < groups.size(); g++) {
            kept[g] = fixed[g];
        }
        int headCount = 0;
        int headEnd = 0;
        while (headEnd < candidates.size() && headCount < preserveFirst) {
            int g = candidates.get(headEnd++);
            kept[g] = true;
            headCount += groups.get(g).size();
        }
        int tailCount = 0;
        for (int c = candidates.size() - 1; c >= headEnd && tailCount < preserveLast; c--) {
            int g = candidates.get(c);
            kept[g] = true;
            tailCount += groups.get(g).size();
        }

        boolean withMarker = true;
        var result = assemble(messages, groups, kept, priorMarker, priorOmitted, withMarker);
        int next = 0;
        while (!MessageGroups.fits(result, budget, estimator)) {
            while (next < candidates.size() && !kept[candidates.get(next)]) {
                next++;
            }
            if (next < candidates.size()) {
                kept[candidates.get(next)] = false;
            } else if (withMarker) {
                withMarker = false;
            } else {
                break;
            }
            result = assemble(messages, groups, kept, priorMarker, priorOmitted, withMarker);
        }
        return result.equals(messages) ? messages : result;
    }

    private static int omittedCount(Message marker) {
        var value = marker.metadata() == null ? null : marker.metadata().get(Message.OMITTED_KEY);
        return value instanceof Number n ? n.intValue() : 0;
    }

    /**
     * Kept groups in order, with one marker at the first dropped position. When nothing new is dropped and the
     * input carried exactly one marker, that marker is reused unchanged.
     */
    private static List<Message> assemble(
            List<Message> messages,
            List<MessageGroups.Group> groups,
            boolean[] kept,
            boolean[] priorMarker,
            int priorOmitted,
            boolean withMarker) {
        int omitted = 0;
        int priorMarkers = 0;
        for (int g = 0; g < groups.size(); g++) {
            if (priorMarker[g]) {
                priorMarkers++;
            } else if (!kept[g]) {
                omitted += groups.get(g).size();
            }
        }
        var result = new ArrayList<Message>(messages.size());
        boolean markerPlaced = !withMarker || omitted + priorMarkers == 0;
        for (int g = 0; g < groups.size(); g++) {
            if (kept[g]) {
                result.addAll(groups.get(g).of(messages));
            } else if (!markerPlaced) {
                result.add(
                        omitted == 0 && priorMarkers == 1
                                ? messages.get(groups.get(g).start())
                                : Message.omissionMarker(omitted + priorOmitted));
                markerPlaced = true;
            }
        }
        return List.copyOf(result);
    }

    @Override
    public String name() {
        return "smart";
    }
}
