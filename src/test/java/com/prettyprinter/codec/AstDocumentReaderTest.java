package com.prettyprinter.codec;

import com.prettyprinter.ast.Decl;
import com.prettyprinter.ast.Expr;
import com.prettyprinter.ast.Program;
import com.prettyprinter.ast.Stat;
import com.prettyprinter.ast.Token;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstDocumentReaderTest {
    private static final Path DOCUMENTS = Path.of("src/test/resources/documents");

    private final AstDocumentReader reader = new AstDocumentReader();

    @Test
    void read_jsonDocument() throws AstDocumentException {
        Program program = reader.read(DOCUMENTS.resolve("hello.json"));

        assertThat(program.name().name()).isEqualTo("main");
        assertThat(program.declarations()).hasSize(2);
        assertThat(program.comments()).hasSize(7).allMatch(c -> c.isBlankLine());

        Decl.FuncDecl main = (Decl.FuncDecl) program.declarations().get(1);
        assertThat(main.signature().hasResults()).isFalse();
        assertThat(main.body().isBraced()).isTrue();

        Stat.ExpressionStat call = (Stat.ExpressionStat) main.body().getStatements().get(0);
        assertThat(call.tok()).isEqualTo(Token.ILLEGAL);
        assertThat(call.expr()).isInstanceOf(Expr.Call.class);
    }

    @Test
    void read_yamlDocument() throws AstDocumentException {
        Program program = reader.read(DOCUMENTS.resolve("limits.yaml"));

        Decl.DeclList list = (Decl.DeclList) program.declarations().get(0);
        assertThat(list.tok()).isEqualTo(Token.CONST);
        assertThat(list.list()).hasSize(2).allMatch(d -> d instanceof Decl.ConstDecl);
        assertThat(program.comments()).filteredOn(c -> c.isLineComment()).hasSize(1);
    }

    @Test
    void read_symbolsAndEnumsByName() throws AstDocumentException {
        Program program = reader.read(DOCUMENTS.resolve("symbols.json"));

        Decl.VarDecl decl = (Decl.VarDecl) program.declarations().get(0);
        Expr.Ident count = decl.names().get(0);
        assertThat(count.symbol()).isNotNull();
        assertThat(count.symbol().isDeclaredAt(count.pos())).isTrue();
        assertThat(((Expr.ChannelType) decl.type()).dir().name()).isEqualTo("RECV");
    }

    @ParameterizedTest
    @ValueSource(strings = {"unknown-node.json", "unknown-property.json", "unordered-comments.yml", "missing-operator.json"})
    void read_rejectsInvalidDocuments(String fileName) {
        Path path = DOCUMENTS.resolve(fileName);

        assertThatThrownBy(() -> reader.read(path))
                .isInstanceOf(AstDocumentException.class)
                .hasMessageStartingWith("Invalid AST document")
                .satisfies(e -> assertThat(((AstDocumentException) e).getDocumentPath()).isEqualTo(path));
    }

    @Test
    void read_namesMissingRequiredComponent() {
        assertThatThrownBy(() -> reader.read(DOCUMENTS.resolve("missing-operator.json")))
                .isInstanceOf(AstDocumentException.class)
                .hasMessageContaining("BinaryExpr")
                .hasMessageContaining("op");
    }

    @Test
    void read_rejectsEmptyContent() {
        Path path = Path.of("empty.json");

        assertThatThrownBy(() -> reader.read(path, "  \n", AstDocumentReader.Format.JSON))
                .isInstanceOf(AstDocumentException.class)
                .hasMessage("AST document is empty");
    }

    @Test
    void read_rejectsMissingFile() {
        assertThatThrownBy(() -> reader.read(DOCUMENTS.resolve("missing.json")))
                .isInstanceOf(AstDocumentException.class)
                .hasMessageStartingWith("Failed to read AST document");
    }

    @Test
    void read_rejectsProgramWithoutName() {
        assertThatThrownBy(() -> reader.read(Path.of("anonymous.json"), "{\"declarations\": []}",
                AstDocumentReader.Format.JSON))
                .isInstanceOf(AstDocumentException.class)
                .hasMessage("AST document has no package name");
    }

    @Test
    void formatOf_selectsByExtension() throws AstDocumentException {
        assertThat(AstDocumentReader.formatOf(Path.of("a.json"))).isEqualTo(AstDocumentReader.Format.JSON);
        assertThat(AstDocumentReader.formatOf(Path.of("a.YML"))).isEqualTo(AstDocumentReader.Format.YAML);
        assertThat(AstDocumentReader.formatOf(Path.of("dir/a.yaml"))).isEqualTo(AstDocumentReader.Format.YAML);
        assertThatThrownBy(() -> AstDocumentReader.formatOf(Path.of("a.go")))
                .isInstanceOf(AstDocumentException.class)
                .hasMessageContaining("a.go");
    }
}
