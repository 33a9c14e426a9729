package tessera.commands;

import tessera.engine.Engine;
import tessera.engine.Reply;

/**
 * A validated, strongly-typed request. Instances are produced by {@link CommandTranslator}
 * and only ever carry arguments that already passed arity and type checks.
 */
public interface Command {
    /** Upper-case command name, for logging. */
    String name();

    // Routes the command to the engine owning its data type.
    Reply execute(Engine engine);
}
