/**
 * Input validation shared by configuration parsing and the CLI.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} with the offending option name.</p>
 */
package ai.drivewise.risk.validation;
