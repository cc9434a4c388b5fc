/**
 * Command-line entry points: the {@code drivewise} dispatcher and its {@code run}, {@code grid} and {@code score}
 * subcommands.
 */
package ai.drivewise.risk.api;
