package com.questrail.plc.interpreter;

/**
 * Non-local exits out of statement lists. These carry no stack trace and
 * never escape the executor: loops catch EXIT and CONTINUE, POU bodies catch
 * RETURN.
 */
final class ControlFlow
{
    static final ExitSignal EXIT = new ExitSignal();
    static final ContinueSignal CONTINUE = new ContinueSignal();
    static final ReturnSignal RETURN = new ReturnSignal();

    private ControlFlow() {
    }

    abstract static class Signal extends RuntimeException
    {
        Signal(String name) {
            super(name, null, false, false);
        }
    }

    static final class ExitSignal extends Signal
    {
        private ExitSignal() {
            super("EXIT");
        }
    }

    static final class ContinueSignal extends Signal
    {
        private ContinueSignal() {
            super("CONTINUE");
        }
    }

    static final class ReturnSignal extends Signal
    {
        private ReturnSignal() {
            super("RETURN");
        }
    }
}
