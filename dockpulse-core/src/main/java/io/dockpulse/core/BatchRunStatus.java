package io.dockpulse.core;

public enum BatchRunStatus {
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
