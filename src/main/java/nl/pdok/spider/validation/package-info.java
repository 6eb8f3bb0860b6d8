/**
 * Input validation shared by the CLI and configuration layers.
 */
package nl.pdok.spider.validation;
