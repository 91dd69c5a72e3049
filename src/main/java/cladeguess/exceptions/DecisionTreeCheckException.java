package cladeguess.exceptions;

import java.io.PrintStream;

/**
 * Thrown when a decision tree fails the placement, disjointness or coverage checks run
 * while it is being reported. The tree is not usable and nothing should be written.
 */
public class DecisionTreeCheckException extends Exception {

    private static final long serialVersionUID = 1L;
    private String msg;

    public DecisionTreeCheckException(String error_msg) {
        this.msg = error_msg;
    }

    @Override
    public String getMessage() {
        return this.msg;
    }

    @Override
    public String toString() {
        return "DecisionTreeCheckException: " + this.msg;
    }

    public void reportFailedAction(PrintStream out, String failedAction) {
        String m = failedAction + " failed due to " + this.toString();
        out.println(m);
    }
}
