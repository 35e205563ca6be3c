/**
 * Saved plan artifacts.
 *
 * <p>{@link com.ryuqq.provisioner.adapter.file.plan.PlanFiles} writes a plan to JSON so it
 * can be reviewed and applied later; staleness is detected at apply time from the
 * recorded state lineage, serial and digest.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.file.plan;
