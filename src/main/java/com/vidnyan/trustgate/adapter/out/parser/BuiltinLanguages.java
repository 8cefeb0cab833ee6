package com.vidnyan.trustgate.adapter.out.parser;

import com.vidnyan.trustgate.adapter.out.parser.javascript.JavaScriptLanguagePlugin;
import com.vidnyan.trustgate.adapter.out.parser.python.PythonLanguagePlugin;
import com.vidnyan.trustgate.domain.language.LanguagePlugin;
import com.vidnyan.trustgate.domain.language.LanguageRegistry;
import com.vidnyan.trustgate.domain.language.TaintCatalog;

import java.util.List;
import java.util.Set;

/**
 * The languages shipped with the engine. Python is registered first and is
 * therefore the default language.
 */
public final class BuiltinLanguages {

    /**
     * Taint sources and sinks shared by the built-in languages.
     * Both grammars see the whole catalog; a name that cannot occur in one
     * language simply never matches there.
     */
    public static final TaintCatalog TAINT_CATALOG = new TaintCatalog(
            Set.of(
                    "input", "raw_input",
                    "os.environ", "os.getenv", "sys.argv",
                    "request.args", "request.form", "request.json",
                    "prompt", "readline",
                    "req.body", "req.query", "req.params"),
            Set.of(
                    "exec", "eval", "compile", "__import__",
                    "os.system", "os.popen", "subprocess.call", "subprocess.run", "subprocess.Popen",
                    "open",
                    "cursor.execute", "db.execute",
                    "child_process.exec", "child_process.spawn",
                    "innerHTML"));

    private BuiltinLanguages() {
    }

    public static List<LanguagePlugin> plugins() {
        return List.of(new PythonLanguagePlugin(), new JavaScriptLanguagePlugin());
    }

    /**
     * Create a registry holding the built-in languages.
     */
    public static LanguageRegistry registry() {
        return LanguageRegistry.of(plugins());
    }
}
