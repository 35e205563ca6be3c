/**
 * JSON file implementation of the state store SPI.
 *
 * <h2>Files</h2>
 * <ul>
 *   <li>{@code <state>} - current state (pretty-printed JSON, keys sorted)</li>
 *   <li>{@code <state>.backup} - previous version, replaced on every save</li>
 *   <li>{@code <state>.lock} - advisory lock file holding the current holder's pid</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.file.state;
