package com.gentoro.kgbridge.cli;

import com.gentoro.kgbridge.exception.IoException;
import com.gentoro.kgbridge.exception.MalformedExportException;
import com.gentoro.kgbridge.exception.ShapeMismatchException;
import com.gentoro.kgbridge.export.ExportDocument;
import com.gentoro.kgbridge.export.ExportDocumentParser;
import com.gentoro.kgbridge.hetero.HeteroGraph;
import com.gentoro.kgbridge.hetero.HeteroGraphAssembler;
import com.gentoro.kgbridge.utility.StdoutUtility;
import java.io.PrintStream;
import java.nio.file.Path;

/** {@code kgbridge export.json --mode hetero}: assemble a tensor export and print its summary. */
public class HeteroGraphCommand {
  private final PrintStream out;
  private final ExportDocumentParser parser;
  private final HeteroGraphAssembler assembler;

  public HeteroGraphCommand(PrintStream out) {
    this(out, new ExportDocumentParser(), new HeteroGraphAssembler());
  }

  public HeteroGraphCommand(
      PrintStream out, ExportDocumentParser parser, HeteroGraphAssembler assembler) {
    this.out = out;
    this.parser = parser;
    this.assembler = assembler;
  }

  public int run(Path exportFile) {
    out.println("Loading graph from: " + exportFile);
    try {
      ExportDocument document = parser.parse(exportFile);
      if (document.tensor().isEmpty()) {
        StdoutUtility.printError(
            out, "Export has no tensor part (nodeFeatures / edgeIndices)", null);
        return ExitCodes.INVALID_INPUT;
      }
      HeteroGraph graph = assembler.assemble(document.tensor().get());
      out.println();
      out.println(graph.summary());
      return ExitCodes.OK;
    } catch (MalformedExportException | ShapeMismatchException | IoException e) {
      StdoutUtility.printError(out, e.getMessage(), null);
      return ExitCodes.INVALID_INPUT;
    }
  }
}
