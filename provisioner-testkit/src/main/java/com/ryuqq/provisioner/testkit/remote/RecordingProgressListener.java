package com.ryuqq.provisioner.testkit.remote;

import com.ryuqq.provisioner.core.executor.ApplyPhase;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.plan.ResourceChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link ProgressListener} that records events as {@code "START dss_dataset.a"}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class RecordingProgressListener implements ProgressListener {

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onProgress(ResourceChange change, ApplyPhase phase) {
        events.add(phase + " " + change.address());
    }

    public List<String> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
