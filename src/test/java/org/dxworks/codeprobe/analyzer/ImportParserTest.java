package org.dxworks.codeprobe.analyzer;

import org.dxworks.codeprobe.lexer.Tokenizer;
import org.dxworks.codeprobe.model.ImportKind;
import org.dxworks.codeprobe.model.ImportRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportParserTest {

    private static List<ImportRecord> parse(String source) {
        return ImportParser.parse(Tokenizer.tokenize(source));
    }

    private static void assertImport(ImportRecord record, String specifier, ImportKind kind, int line) {
        assertEquals(specifier, record.sourceSpecifier);
        assertEquals(kind, record.kind);
        assertEquals(line, record.line);
    }

    @Test
    void parse_StaticImportForms() {
        List<ImportRecord> imports = parse("import { foo } from './foo.js';\n"
                + "import bar from './bar.js';\n"
                + "import * as ns from './utils.js';\n"
                + "import def, { a as b, c } from \"pkg\";\n"
                + "import './side-effect.js';");
        assertEquals(5, imports.size());
        assertImport(imports.get(0), "./foo.js", ImportKind.STATIC_IMPORT, 1);
        assertImport(imports.get(1), "./bar.js", ImportKind.STATIC_IMPORT, 2);
        assertImport(imports.get(2), "./utils.js", ImportKind.STATIC_IMPORT, 3);
        assertImport(imports.get(3), "pkg", ImportKind.STATIC_IMPORT, 4);
        assertImport(imports.get(4), "./side-effect.js", ImportKind.STATIC_IMPORT, 5);
    }

    @Test
    void parse_ExportFrom() {
        List<ImportRecord> imports = parse("export { foo } from './foo.js';\n"
                + "export * from './all.js';\n"
                + "export * as helpers from './helpers.js';\n"
                + "export { default } from './main.js';");
        assertEquals(4, imports.size());
        assertImport(imports.get(0), "./foo.js", ImportKind.EXPORT_FROM, 1);
        assertImport(imports.get(1), "./all.js", ImportKind.EXPORT_FROM, 2);
        assertImport(imports.get(2), "./helpers.js", ImportKind.EXPORT_FROM, 3);
        assertImport(imports.get(3), "./main.js", ImportKind.EXPORT_FROM, 4);
    }

    @Test
    void parse_LocalExportsAreNotImports() {
        assertTrue(parse("export const x = 42;\nexport default { a, b };\nexport function f() { }\nexport { x };")
                .isEmpty());
    }

    @Test
    void parse_DynamicImport() {
        List<ImportRecord> imports = parse("const mod = await import('./plugin.js');\nimport(`./lazy.js`);");
        assertEquals(2, imports.size());
        assertImport(imports.get(0), "./plugin.js", ImportKind.DYNAMIC_IMPORT, 1);
        assertImport(imports.get(1), "./lazy.js", ImportKind.DYNAMIC_IMPORT, 2);
    }

    @Test
    void parse_ComputedDynamicImportIsSkipped() {
        assertTrue(parse("import(name);\nimport('./a/' + name);").isEmpty());
    }

    @Test
    void parse_Require() {
        List<ImportRecord> imports = parse("const fs = require('fs');\nconst path = require(\"node:path\");");
        assertEquals(2, imports.size());
        assertImport(imports.get(0), "fs", ImportKind.MODULE_REQUIRE, 1);
        assertImport(imports.get(1), "node:path", ImportKind.MODULE_REQUIRE, 2);
    }

    @Test
    void parse_RequireWithComputedArgumentIsSkipped() {
        assertTrue(parse("require(name); require('a' + b);").isEmpty());
    }

    @Test
    void parse_ReferencesInStringsAndCommentsAreIgnored() {
        assertTrue(parse("// import x from './x.js'\nconst s = \"require('y')\";\n/* export * from 'z' */").isEmpty());
    }

    @Test
    void parse_NoImports() {
        assertTrue(parse("export const x = 42;").isEmpty());
        assertTrue(parse("").isEmpty());
    }

    @Test
    void parse_LineNumbersFollowTheKeyword() {
        List<ImportRecord> imports = parse("\nimport foo from './foo.js';\nimport bar from './bar.js';");
        assertEquals(2, imports.get(0).line);
        assertEquals(3, imports.get(1).line);
    }

    @Test
    void parse_MultilineImportClause() {
        List<ImportRecord> imports = parse("import {\n  a,\n  b,\n} from './ab.js';");
        assertEquals(1, imports.size());
        assertImport(imports.get(0), "./ab.js", ImportKind.STATIC_IMPORT, 1);
    }

    @Test
    void parse_KeywordBindingNames() {
        List<ImportRecord> imports = parse("import { of } from 'rxjs';\n"
                + "import { get, set } from 'lodash';\n"
                + "export { async } from './x';\n"
                + "import { from } from 'rxjs';\n"
                + "import { static as s, default as d } from './kw.js';");
        assertEquals(5, imports.size());
        assertImport(imports.get(0), "rxjs", ImportKind.STATIC_IMPORT, 1);
        assertImport(imports.get(1), "lodash", ImportKind.STATIC_IMPORT, 2);
        assertImport(imports.get(2), "./x", ImportKind.EXPORT_FROM, 3);
        assertImport(imports.get(3), "rxjs", ImportKind.STATIC_IMPORT, 4);
        assertImport(imports.get(4), "./kw.js", ImportKind.STATIC_IMPORT, 5);
    }

    @Test
    void parse_ClauseWalkStopsAtTheNextStatement() {
        List<ImportRecord> imports = parse("export class A {}\nimport b from './b.js';");
        assertEquals(1, imports.size());
        assertImport(imports.get(0), "./b.js", ImportKind.STATIC_IMPORT, 2);
    }

    @Test
    void stripQuotes_RemovesMatchingQuotes() {
        assertEquals("abc", ImportParser.stripQuotes("'abc'"));
        assertEquals("abc", ImportParser.stripQuotes("\"abc\""));
        assertEquals("abc", ImportParser.stripQuotes("`abc`"));
        assertEquals("abc", ImportParser.stripQuotes("'abc"));
    }
}
