package tmengine;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Loads the CSV fixtures under {@code /machines}. */
final class Machines {
    private Machines() {}

    static MachineDefinition load(String name) {
        final var path = "/machines/" + name + ".csv";
        try (InputStream in = Objects.requireNonNull(Machines.class.getResourceAsStream(path), path)) {
            return MachineParser.parse(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static MachineDefinition anbn() { return load("anbn"); }
    static MachineDefinition containsBb() { return load("contains-bb"); }
    static MachineDefinition noMoves() { return load("no-moves"); }
    static MachineDefinition blankWalker() { return load("blank-walker"); }
}
