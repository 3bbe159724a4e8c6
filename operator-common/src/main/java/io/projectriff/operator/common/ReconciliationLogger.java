/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;
import org.apache.logging.log4j.util.Supplier;

import java.io.Serializable;

/**
 * Logger wrapper with two families of methods: {@code *Op} for operator level messages and {@code *Cr} for messages
 * which belong to the reconciliation of a single custom resource. The {@code *Cr} methods prefix the message with the
 * reconciliation and attach its marker.
 */
public class ReconciliationLogger implements Serializable {
    private static final long serialVersionUID = 2588107401491740L;

    /**
     * Wrapped logger which we extend
     */
    private final ExtendedLoggerWrapper logger;

    private static final String FQCN = ReconciliationLogger.class.getName();

    protected ReconciliationLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as
     * the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final Class<?> loggerName) {
        final Logger wrapped = LogManager.getLogger(loggerName);
        return new ReconciliationLogger(wrapped);
    }

    /**
     * Returns a custom Logger with the specified name.
     *
     * @param name The logger name.
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final String name) {
        final Logger wrapped = LogManager.getLogger(name);
        return new ReconciliationLogger(wrapped);
    }

    /**
     * Logs a message with parameters at the {@code TRACE} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void traceOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.TRACE, null, message, params);
    }

    /**
     * Logs a message at the {@code TRACE} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void traceOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.TRACE, null, message, t);
    }

    /**
     * Logs a message with parameters at the {@code TRACE} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void traceCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.TRACE, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * Logs a message at the {@code TRACE} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void traceCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.TRACE, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * Logs a message which is only to be constructed if the logging level is the {@code TRACE} level.
     *
     * @param reconciliation The reconciliation
     * @param msgSupplier A function, which when called, produces the desired log message.
     */
    public void traceCr(final Reconciliation reconciliation, final Supplier<?> msgSupplier) {
        if (logger.isEnabled(Level.TRACE, reconciliation.getMarker())) {
            logger.logIfEnabled(FQCN, Level.TRACE, reconciliation.getMarker(), reconciliation.toString() + ": " + msgSupplier.get(), (Throwable) null);
        }
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void debugOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, params);
    }

    /**
     * Logs a message at the {@code DEBUG} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void debugOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, t);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void debugCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * Logs a message at the {@code DEBUG} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void debugCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.DEBUG, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * Logs a message which is only to be constructed if the logging level is the {@code DEBUG} level.
     *
     * @param reconciliation The reconciliation
     * @param msgSupplier A function, which when called, produces the desired log message.
     */
    public void debugCr(final Reconciliation reconciliation, final Supplier<?> msgSupplier) {
        if (logger.isEnabled(Level.DEBUG, reconciliation.getMarker())) {
            logger.logIfEnabled(FQCN, Level.DEBUG, reconciliation.getMarker(), reconciliation.toString() + ": " + msgSupplier.get(), (Throwable) null);
        }
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void infoOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, params);
    }

    /**
     * Logs a message at the {@code INFO} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void infoOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, t);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void infoCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * Logs a message at the {@code INFO} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void infoCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.INFO, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void warnOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, params);
    }

    /**
     * Logs a message at the {@code WARN} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void warnOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, t);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * Logs a message at the {@code WARN} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.WARN, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void errorOp(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, params);
    }

    /**
     * Logs a message at the {@code ERROR} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void errorOp(final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, t);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    /**
     * Logs a message at the {@code ERROR} level including the stack trace of
     * the {@link Throwable} {@code t} passed as parameter.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logger.logIfEnabled(FQCN, Level.ERROR, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * @return  True if debug logging is enabled. False otherwise.
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * @return  True if trace logging is enabled. False otherwise.
     */
    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }
}
