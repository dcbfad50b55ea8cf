package io.jobwarden;

import io.jobwarden.core.ChangeContext;

/**
 * Change-notification hook invoked after an automation job saved a record.
 * Not invoked for jobs that disable notifications.
 */
public interface RecordChangeListener {

    void onChange(TargetRecord record, ChangeContext context);
}
