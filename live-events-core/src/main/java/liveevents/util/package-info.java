/**
 * Utility classes: JSON codec and the worker thread factory.
 */
package liveevents.util;
