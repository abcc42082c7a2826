package com.paymsg.satellites.reconciliation;

import com.paymsg.canonical.InvestigationCase;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.ReferencesOriginalMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.config.TranscoderSettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Links messages that belong to the same payment.
 *
 * Two records match when they share an identifier, tried in this order:
 * <ol>
 *   <li>UETR</li>
 *   <li>end-to-end id</li>
 *   <li>an original message id (status report, return or recall) naming the
 *   other record's message id</li>
 *   <li>the case id of two investigation records</li>
 * </ol>
 * and their amounts confirm the link. Amounts confirm when they are equal, or
 * within the configured relative tolerance when fees may have been taken;
 * a missing amount or differing currencies leave the identifier match standing.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final BigDecimal tolerance;

    public Reconciler() {
        this(TranscoderSettingsLoader.defaults());
    }

    public Reconciler(TranscoderSettings settings) {
        this.tolerance = settings.getFuzzyAmountTolerance() != null
            ? settings.getFuzzyAmountTolerance()
            : BigDecimal.ZERO;
    }

    public boolean isMatch(PaymentMessage a, PaymentMessage b) {
        return isMatch(a, b, false);
    }

    /**
     * @param fuzzyAmount accept amounts that differ by up to the tolerance,
     *                    relative to the larger amount
     */
    public boolean isMatch(PaymentMessage a, PaymentMessage b, boolean fuzzyAmount) {
        if (a == null || b == null) {
            return false;
        }
        if (!identifiersMatch(a, b)) {
            return false;
        }
        return amountsConfirm(a, b, fuzzyAmount);
    }

    /**
     * Candidates matching {@code primary}, in candidate order. The primary
     * itself is never returned.
     */
    public List<PaymentMessage> findMatches(PaymentMessage primary, List<? extends PaymentMessage> candidates) {
        List<PaymentMessage> matches = new ArrayList<>();
        if (primary == null || candidates == null) {
            return matches;
        }
        for (PaymentMessage candidate : candidates) {
            if (candidate == primary) {
                continue;
            }
            if (isMatch(primary, candidate)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    /**
     * Every message reachable from {@code seed} through the match relation,
     * seed first, then in breadth-first discovery order. Each record object
     * appears once, even when links form a cycle.
     */
    public List<PaymentMessage> traceLifecycle(PaymentMessage seed, List<? extends PaymentMessage> allMessages) {
        List<PaymentMessage> timeline = new ArrayList<>();
        if (seed == null) {
            return timeline;
        }
        Set<PaymentMessage> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<PaymentMessage> queue = new ArrayDeque<>();
        timeline.add(seed);
        seen.add(seed);
        queue.add(seed);

        while (!queue.isEmpty()) {
            PaymentMessage current = queue.poll();
            for (PaymentMessage match : findMatches(current, allMessages)) {
                if (seen.add(match)) {
                    timeline.add(match);
                    queue.add(match);
                }
            }
        }
        log.debug("Traced lifecycle of {} across {} message(s)", seed.getMessageId(), timeline.size());
        return timeline;
    }

    private static boolean identifiersMatch(PaymentMessage a, PaymentMessage b) {
        // UETRs compare case-insensitively
        if (present(a.getUetr()) && present(b.getUetr()) && a.getUetr().trim().equalsIgnoreCase(b.getUetr().trim())) {
            return true;
        }
        if (present(a.getEndToEndId()) && a.getEndToEndId().equals(b.getEndToEndId())) {
            return true;
        }
        if (referencesOriginal(a, b) || referencesOriginal(b, a)) {
            return true;
        }
        if (a instanceof InvestigationCase && b instanceof InvestigationCase) {
            String caseId = ((InvestigationCase) a).getCaseId();
            return present(caseId) && caseId.equals(((InvestigationCase) b).getCaseId());
        }
        return false;
    }

    private static boolean referencesOriginal(PaymentMessage reference, PaymentMessage original) {
        if (!(reference instanceof ReferencesOriginalMessage)) {
            return false;
        }
        String originalMessageId = ((ReferencesOriginalMessage) reference).getOriginalMessageId();
        return present(originalMessageId) && originalMessageId.equals(original.getMessageId());
    }

    private boolean amountsConfirm(PaymentMessage a, PaymentMessage b, boolean fuzzyAmount) {
        if (!present(a.getAmount()) || !present(b.getAmount()) || !Objects.equals(a.getCurrency(), b.getCurrency())) {
            return true;
        }
        BigDecimal amountA;
        BigDecimal amountB;
        try {
            amountA = new BigDecimal(a.getAmount().trim());
            amountB = new BigDecimal(b.getAmount().trim());
        } catch (NumberFormatException e) {
            log.debug("Comparing non-numeric amounts '{}' and '{}' as text", a.getAmount(), b.getAmount());
            return a.getAmount().equals(b.getAmount());
        }
        if (!fuzzyAmount) {
            return amountA.compareTo(amountB) == 0;
        }
        BigDecimal allowed = amountA.max(amountB).multiply(tolerance);
        return amountA.subtract(amountB).abs().compareTo(allowed) <= 0;
    }

    private static boolean present(String value) {
        return value != null && !value.isEmpty();
    }
}
