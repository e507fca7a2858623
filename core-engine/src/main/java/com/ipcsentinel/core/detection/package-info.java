/**
 * Attack-pattern heuristics evaluated over the security-event history.
 *
 * <p>
 * All patterns implement
 * {@link com.ipcsentinel.core.detection.AttackPattern} and are created by
 * {@link com.ipcsentinel.core.detection.AttackPatternFactory}. Built-in
 * patterns:
 * </p>
 * <ul>
 * <li>{@link com.ipcsentinel.core.detection.RapidChannelSwitchingPattern} –
 * many distinct channels in a few seconds</li>
 * <li>{@link com.ipcsentinel.core.detection.PrivilegeEscalationPattern} –
 * repeated rejected calls on privileged channels</li>
 * <li>{@link com.ipcsentinel.core.detection.DdosAttackPattern} – flood of
 * rate-limit rejections</li>
 * <li>{@link com.ipcsentinel.core.detection.AutomatedAttackPattern} –
 * near-constant inter-arrival times</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * Implement {@code AttackPattern} and pass it to the monitor builder, or add
 * it to {@code AttackPatternFactory.createAll()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.detection;
