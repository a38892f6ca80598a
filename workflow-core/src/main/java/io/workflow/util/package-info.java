/**
 * Internal helpers shared by the engine modules.
 */
package io.workflow.util;
