/**
 * Threading and JSON helpers shared by the pipeline components.
 */
package io.meetflow.util;
