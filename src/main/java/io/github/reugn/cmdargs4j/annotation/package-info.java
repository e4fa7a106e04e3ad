/**
 * Annotations describing the command-line schema of an argument class.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.cmdargs4j.annotation.RequiredArgument} - Positional argument that must be supplied</li>
 *   <li>{@link io.github.reugn.cmdargs4j.annotation.OptionalArgument} - Named argument with a default</li>
 *   <li>{@link io.github.reugn.cmdargs4j.annotation.ActionArgument} - Field selecting the active mode</li>
 *   <li>{@link io.github.reugn.cmdargs4j.annotation.ArgumentGroup} - Assigns an argument to one mode</li>
 *   <li>{@link io.github.reugn.cmdargs4j.annotation.CommonArgument} - Shares an argument across all modes</li>
 * </ul>
 * <p>
 * Every annotation in this package is checked at compile time by
 * {@link io.github.reugn.cmdargs4j.processor.ArgumentSchemaProcessor}, which rejects
 * inconsistent schemas before they are ever used to parse input.
 *
 * @see io.github.reugn.cmdargs4j.processor.ArgumentSchemaProcessor
 */
package io.github.reugn.cmdargs4j.annotation;
