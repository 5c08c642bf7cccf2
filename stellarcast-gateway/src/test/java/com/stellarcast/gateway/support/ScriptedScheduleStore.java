package com.stellarcast.gateway.support;

import com.stellarcast.channel.Destination;
import com.stellarcast.gateway.cron.ScheduleEntry;
import com.stellarcast.gateway.cron.ScheduleStore;
import com.stellarcast.gateway.cron.ScheduleStoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Schedule store whose writes can be made to fail, with a one-shot hook that
 * runs right after the next locked load.
 */
public class ScriptedScheduleStore extends ScheduleStore {

    public volatile boolean failWrites;
    public final AtomicReference<Runnable> afterNextLoad = new AtomicReference<>();

    public ScriptedScheduleStore(Path file) {
        super(file);
    }

    @Override
    public List<ScheduleEntry> loadLocked() {
        List<ScheduleEntry> entries = super.loadLocked();
        Runnable hook = afterNextLoad.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
        return entries;
    }

    @Override
    public void upsertLocked(ScheduleEntry entry) {
        checkWritable();
        super.upsertLocked(entry);
    }

    @Override
    public boolean removeLocked(Destination destination) {
        checkWritable();
        return super.removeLocked(destination);
    }

    @Override
    public void replaceAllLocked(List<ScheduleEntry> entries) {
        checkWritable();
        super.replaceAllLocked(entries);
    }

    private void checkWritable() {
        if (failWrites) {
            throw new ScheduleStoreException("failed to write schedule file " + getFile(),
                    new IOException("disk full"));
        }
    }
}
