/**
 * Command-line entry points: the {@code spider} dispatcher and its {@code layers} and {@code services}
 * commands, exit codes, and argument parsing.
 */
package nl.pdok.spider.api;
