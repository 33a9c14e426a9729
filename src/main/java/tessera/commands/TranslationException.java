package tessera.commands;

/**
 * Raised when a wire value cannot be turned into a {@link Command}. Nothing has been
 * executed when this is thrown.
 */
public class TranslationException extends Exception {

    public enum Kind {
        /** Empty request. Callers are expected to ignore it rather than reply. */
        NOOP,
        UNKNOWN_OP,
        NOT_ENOUGH_ARGS,
        WRONG_NUMBER_OF_ARGS,
        INVALID_TYPE,
        SYNTAX_ERROR
    }

    private final Kind kind;
    private final int arity;

    private TranslationException(Kind kind, int arity, String message) {
        super(message);
        this.kind = kind;
        this.arity = arity;
    }

    public static TranslationException noop() {
        return new TranslationException(Kind.NOOP, -1, "no-op");
    }

    public static TranslationException unknownOp() {
        return new TranslationException(Kind.UNKNOWN_OP, -1, "ERR unknown command");
    }

    public static TranslationException notEnoughArgs(int min) {
        return new TranslationException(Kind.NOT_ENOUGH_ARGS, min, "ERR not enough arguments(" + min + ")");
    }

    public static TranslationException wrongNumberOfArgs(int expected) {
        return new TranslationException(Kind.WRONG_NUMBER_OF_ARGS, expected, "ERR wrong number of arguments(" + expected + ")");
    }

    public static TranslationException invalidType() {
        return new TranslationException(Kind.INVALID_TYPE, -1, "ERR invalid argument type");
    }

    public static TranslationException syntaxError() {
        return new TranslationException(Kind.SYNTAX_ERROR, -1, "ERR syntax error");
    }

    public Kind getKind() {
        return kind;
    }

    /** Required argument count for the two arity kinds, -1 otherwise. */
    public int getArity() {
        return arity;
    }
}
