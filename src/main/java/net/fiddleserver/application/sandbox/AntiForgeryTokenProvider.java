package net.fiddleserver.application.sandbox;

/**
 * Supplies the anti-forgery token bound to the request being rendered.
 */
@FunctionalInterface
public interface AntiForgeryTokenProvider {

    String currentToken();
}
