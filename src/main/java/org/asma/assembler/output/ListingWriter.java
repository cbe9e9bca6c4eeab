package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.ListingLine;
import org.asma.assembler.api.OutputFile;
import org.asma.assembler.api.SymbolSummary;
import org.asma.assembler.diagnostics.Diagnostic;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the assembly listing to {@code <image>.lst}: each statement with its location
 * and object code, errors below the failing statement, then the diagnostics summary and
 * the symbol cross reference.
 */
public class ListingWriter implements IOutputWriter {

    /** Object code bytes shown on one listing line. */
    private static final int CODE_BYTES = 8;

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("%-8s %-16s %5s  %s\n", "LOC", "OBJECT CODE", "STMT", "SOURCE STATEMENT"));
        for (ListingLine line : result.listing()) {
            appendStatement(out, line);
        }
        out.append('\n');
        long errors = result.diagnostics().stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
        out.append(String.format("%d error(s), %d warning(s)\n", errors, result.diagnostics().size() - errors));
        out.append('\n').append("SYMBOL CROSS REFERENCE\n");
        out.append(String.format("%-16s %-8s %-10s %8s %s %5s  %s\n", "NAME", "KIND", "VALUE", "LENGTH", "T", "DEFN", "REFERENCES"));
        for (SymbolSummary symbol : result.symbols()) {
            String references = symbol.references().stream().map(String::valueOf).collect(Collectors.joining(" "));
            out.append(String.format("%-16s %-8s %-10s %8d %c %5d  %s\n", symbol.name(), symbol.kind(), symbol.value(),
                    symbol.length(), symbol.type(), symbol.definedAt(), references).stripTrailing()).append('\n');
        }
        return List.of(new OutputFile(result.imageName() + ".lst", out.toString().getBytes(StandardCharsets.UTF_8)));
    }

    private static void appendStatement(StringBuilder out, ListingLine line) {
        String location = line.location() == null ? "" : String.format("%06X", line.location());
        byte[] code = line.objectCode();
        int shown = Math.min(code.length, CODE_BYTES);
        StringBuilder hex = new StringBuilder();
        for (int i = 0; i < shown; i++) {
            hex.append(String.format("%02X", code[i] & 0xFF));
        }
        out.append(String.format("%-8s %-16s %5d  %s", location, hex, line.statement(), line.source().text()).stripTrailing())
                .append('\n');
        if (line.error() != null) {
            out.append(String.format("** ERROR ** %s\n", line.error()));
        }
    }
}
