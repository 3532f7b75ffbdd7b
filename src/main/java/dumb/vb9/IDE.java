package dumb.vb9;

import java.util.Arrays;
import java.util.List;

import static dumb.vb9.Log.error;
import static dumb.vb9.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Designer, compiler and runtime stages wired around one {@link Namespace}.
 */
public class IDE implements AutoCloseable {

    public static final String SOURCE_PATH = "/form/source.scm";
    public static final String DRAW_PATH = "/dev/draw";
    public static final String DESIGNER = "designer";
    static final String DEMO_FORM = "(widget (button ok) (textbox name))";

    public final Namespace ns;
    public final Goals goals;
    public final Configuration config;
    private final KernelCompiler compiler;
    private final RuntimeLoop runtime;

    public IDE() {
        this(new Namespace(), Goals.example(), Configuration.load());
    }

    public IDE(Namespace ns, Goals goals, Configuration config) {
        this.ns = requireNonNull(ns);
        this.goals = requireNonNull(goals);
        this.config = requireNonNull(config);
        this.compiler = new KernelCompiler(ns, goals);
        this.runtime = new RuntimeLoop(ns, config.pollTimeoutMillis(), config.stopTimeoutMillis());
    }

    public static void main(String[] args) {
        var form = args.length > 0 ? String.join(" ", args) : DEMO_FORM;
        try (var ide = new IDE()) {
            var expr = ide.designer(form);
            ide.compile(expr);
            ide.runtime();
            ide.ns.enqueue("(button ok click)");
            ide.ns.enqueue("(textbox name focus)");
            Thread.sleep(250);

            ide.ns.events().forEach(e -> System.out.println("EVENT " + e.kind() + ": " + e.detail()));
            System.out.println("Last path: " + ide.ns.read(RuntimeLoop.LAST_PATH).orElse(null));
            System.out.println("Manifest:\n" + ide.ns.read(Manifest.PATH).orElse(null));
            ide.ns.read(DRAW_PATH, int[][].class)
                    .map(Glyphs::convolve)
                    .filter(conv -> conv.length > 0)
                    .ifPresent(conv -> System.out.println("Convolution sample (first 3 rows): "
                            + Arrays.deepToString(Arrays.copyOf(conv, Math.min(3, conv.length)))));
        } catch (SexpParser.ParseException e) {
            error("Cannot parse form: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error("Demo interrupted.");
        }
    }

    /**
     * Parses the form, renders its glyph to {@value #DRAW_PATH} and stores the source at
     * {@value #SOURCE_PATH}.
     */
    public Expr designer(String src) throws SexpParser.ParseException {
        var expr = SexpParser.parse(src);
        var bitmap = Glyphs.bitmap(expr);
        ns.write(DRAW_PATH, bitmap);
        ns.write(SOURCE_PATH, src);
        var width = bitmap.length > 0 ? bitmap[0].length : 0;
        ns.log(DESIGNER, "bitmap " + bitmap.length + "x" + width);
        return expr;
    }

    public List<Kernel> compile(Expr expr) {
        var kernels = compiler.compile(expr);
        var changed = kernels.stream().filter(Kernel::changed).count();
        message(String.format("Compiled %d kernels (%d changed).", kernels.size(), changed));
        return kernels;
    }

    public List<Kernel> compile(String src) throws SexpParser.ParseException {
        return compile(SexpParser.parse(src));
    }

    /**
     * Mounts the form directory on the application mount point and starts the runtime loop if it
     * is not already running. A loop still winding down from a timed-out stop is not restarted;
     * see {@link #isStopping()}.
     */
    public void runtime() {
        ns.mount(config.mountSource(), config.mountPoint());
        if (!runtime.start() && !runtime.isStopping()) message("Runtime already running.");
    }

    public boolean isRunning() {
        return runtime.isRunning();
    }

    public boolean isStopping() {
        return runtime.isStopping();
    }

    public void stop() {
        runtime.stop();
    }

    @Override
    public void close() {
        stop();
        ns.close();
    }
}
