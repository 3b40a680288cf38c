/**
 * Action handlers and their registry.
 *
 * <p>Built-in handlers live in {@link io.bulkaction.action.builtin}.
 */
package io.bulkaction.action;
