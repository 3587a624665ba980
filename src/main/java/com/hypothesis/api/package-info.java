/**
 * REST API layer: the chat controller and its DTOs.
 *
 * <p>Each POST to {@code /api/v1/chat} is one turn: one utterance in, one reply out. Session history can be
 * read, cleared or torn down, and an in-flight research turn can be abandoned between steps.
 */
package com.hypothesis.api;
