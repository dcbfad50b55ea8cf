package io.jobwarden.engine;

import io.jobwarden.RecordChangeListener;
import io.jobwarden.RecordStore;
import io.jobwarden.TargetRecord;
import io.jobwarden.core.ChangeContext;
import io.jobwarden.core.PerformAction;
import io.jobwarden.utils.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Writes a job's perform assignments to a matched record.
 *
 * <p>Assignments whose target already equals the current value are skipped; a record with
 * nothing left to change is not saved at all, so its own modification stamp stays untouched.
 */
public class ActionApplier {
    private static final Logger log = LoggerFactory.getLogger(ActionApplier.class);

    private final RecordStore recordStore;
    private final List<RecordChangeListener> listeners;

    public ActionApplier(RecordStore recordStore, List<RecordChangeListener> listeners) {
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    /**
     * @return true when the record was changed and saved
     */
    public boolean apply(List<PerformAction> perform, TargetRecord record, ChangeContext context) {
        boolean changed = false;
        for (PerformAction action : perform) {
            Object current = record.get(action.path());
            if (Values.sameValue(current, action.value())) {
                continue;
            }
            record.set(action.path(), action.value());
            changed = true;
        }
        if (!changed) {
            return false;
        }

        recordStore.save(record, context);
        log.debug("jobwarden record changed job={} record={} actor={}", context.jobName(), record.id(), context.actorId());

        if (!context.disableNotification()) {
            for (RecordChangeListener listener : listeners) {
                try {
                    listener.onChange(record, context);
                } catch (RuntimeException e) {
                    log.warn("jobwarden change listener failed record={} msg={}", record.id(), e.getMessage(), e);
                }
            }
        }
        return true;
    }
}
