/**
 * Fake remote system, handlers and fixtures for engine tests.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.testkit.remote.InMemoryRemote} - object store with call log, failure injection and blocking</li>
 *   <li>{@link com.ryuqq.provisioner.testkit.remote.InMemoryResourceHandler} - handler over the fake remote</li>
 *   <li>{@link com.ryuqq.provisioner.testkit.remote.TestResourceTypes} - registry and resource fixtures</li>
 *   <li>{@link com.ryuqq.provisioner.testkit.remote.RecordingProgressListener} - progress event recorder</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.remote;
