package io.springsecurity.jwtguard.token.codec;

/**
 * A single configuration step applied to a private copy of the codec settings.
 *
 * @see TokenCodecOptions
 */
@FunctionalInterface
public interface TokenCodecOption {

    void apply(TokenCodecSettings settings);
}
