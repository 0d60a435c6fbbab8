package com.flowgrid.orchestrator.flow.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StepParserTest {

    private final StepParser parser = new StepParser();

    static final String TOP_CUSTOMERS = """
            FLOW "Top customers"

            INPUTS
              file sales_csv
              text region (optional)
            END INPUTS

            STEP load =
              LOAD CSV FROM sales_csv

            STEP filtered =
              FILTER load WHERE amount > 0

            STEP output =
              OUTPUT filtered AS "Result"

            END FLOW
            """;

    @Test
    void parsesHeaderInputsAndSteps() {
        CompileResult result = parser.parse(TOP_CUSTOMERS, true);

        assertThat(result.ok()).isTrue();
        assertThat(result.errors()).isEmpty();
        WorkflowAst ast = result.ast();
        assertThat(ast.name()).isEqualTo("Top customers");
        assertThat(ast.inputs()).containsExactly(
                new FlowInputDecl("sales_csv", FlowInputType.FILE, false),
                new FlowInputDecl("region", FlowInputType.TEXT, true));
        assertThat(ast.steps()).extracting(FlowStep::name).containsExactly("load", "filtered", "output");
        assertThat(ast.steps()).extracting(FlowStep::keyword)
                .containsExactly(OperationKeyword.LOAD_CSV, OperationKeyword.FILTER, OperationKeyword.OUTPUT);
        assertThat(ast.steps().get(1).bodyLines()).containsExactly("FILTER load WHERE amount > 0");
        assertThat(ast.steps().get(0).startLine()).isEqualTo(8);
    }

    @Test
    void inlineBodyOnDeclarationLine() {
        CompileResult result = parser.parse("""
                FLOW "inline"
                STEP a = LOAD TABLE "orders"
                STEP b = TAKE 3
                END FLOW
                """, true);

        assertThat(result.ok()).isTrue();
        assertThat(result.ast().steps().get(0).bodyLines()).containsExactly("LOAD TABLE \"orders\"");
        assertThat(result.ast().steps().get(1).keyword()).isEqualTo(OperationKeyword.TAKE);
    }

    @Test
    void multiLineBodiesAreKept() {
        CompileResult result = parser.parse("""
                FLOW "agents"
                STEP plan =
                  RUN AGENT "planner"
                  WITH {
                    goal: "launch"
                  }
                END FLOW
                """, true);

        assertThat(result.ast().steps().get(0).bodyLines())
                .containsExactly("RUN AGENT \"planner\"", "WITH {", "goal: \"launch\"", "}");
    }

    @Test
    void missingHeader_isError() {
        CompileResult result = parser.parse("""
                STEP bogus =
                  OUTPUT_TEXT "hi"
                """, true);

        assertThat(result.ok()).isFalse();
        assertThat(result.ast()).isNull();
        assertThat(result.errors()).containsExactly("Missing FLOW header");
    }

    @Test
    void noSteps_warningWhenLenient_errorWhenStrict() {
        String source = "FLOW \"empty\"\nEND FLOW\n";

        CompileResult lenient = parser.parse(source, false);
        CompileResult strict = parser.parse(source, true);

        assertThat(lenient.ok()).isTrue();
        assertThat(lenient.warnings()).contains("No STEP definitions found");
        assertThat(strict.ok()).isFalse();
        assertThat(strict.errors()).contains("No STEP definitions found");
    }

    @Test
    void missingEndFlowAndInputsTerminator_areWarnings() {
        CompileResult result = parser.parse("""
                FLOW "loose"
                INPUTS
                  table orders
                STEP a =
                  LOAD TABLE orders
                """, true);

        assertThat(result.ok()).isTrue();
        assertThat(result.ast().inputs()).isEmpty();
        assertThat(result.warnings())
                .contains("INPUTS block missing END INPUTS terminator", "Missing END FLOW terminator");
    }

    @Test
    void unknownInputType_treatedAsText() {
        CompileResult result = parser.parse("""
                FLOW "types"
                INPUTS
                  spreadsheet sheet
                  lonely
                END INPUTS
                STEP a =
                  LOAD JSON FROM sheet
                END FLOW
                """, true);

        assertThat(result.ast().inputs()).containsExactly(new FlowInputDecl("sheet", FlowInputType.TEXT, false));
        assertThat(result.warnings()).hasSize(2);
    }

    @Test
    void unknownOperation_leavesKeywordEmpty() {
        CompileResult result = parser.parse("""
                FLOW "odd"
                STEP a =
                  EXPLODE everything
                END FLOW
                """, true);

        assertThat(result.ok()).isTrue();
        assertThat(result.ast().steps().get(0).keyword()).isNull();
    }

    @Test
    void keywordInference_respectsWordBoundaries() {
        assertThat(OperationKeyword.infer("OUTPUT_TEXT \"hi\"")).contains(OperationKeyword.OUTPUT_TEXT);
        assertThat(OperationKeyword.infer("output result")).contains(OperationKeyword.OUTPUT);
        assertThat(OperationKeyword.infer("load   csv from x")).contains(OperationKeyword.LOAD_CSV);
        assertThat(OperationKeyword.infer("FILTERED x")).isEmpty();
    }

    @Test
    void parsingIsDeterministic() {
        assertThat(parser.parse(TOP_CUSTOMERS, true)).isEqualTo(parser.parse(TOP_CUSTOMERS, true));
    }
}
