package com.rulebook.compiler;

import com.rulebook.codegen.EntitySourceGenerator;
import com.rulebook.codegen.GeneratedFunction;
import com.rulebook.codegen.JavaCodeGenerator;
import com.rulebook.core.FieldResult;
import com.rulebook.dependency.DependencyCollector;
import com.rulebook.dependency.DependencyResolver;
import com.rulebook.dependency.LevelAssignment;
import com.rulebook.evaluation.EvaluatedRecord;
import com.rulebook.evaluation.FieldRecord;
import com.rulebook.evaluation.RecordEvaluator;
import com.rulebook.evaluation.ReferenceEvaluator;
import com.rulebook.exception.RulebookException;
import com.rulebook.formula.Formulas;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.graph.GraphExporter;
import com.rulebook.graph.ProvenanceGraph;
import com.rulebook.schema.EntitySchema;
import com.rulebook.schema.Field;
import com.rulebook.schema.Rulebook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles a rulebook: parses every formula, orders the calculated fields of each
 * entity, then generates Java source and a provenance graph per field.
 * <p>
 * Entities are independent and compile concurrently. A failing field never stops
 * its siblings; its error is recorded in the result.
 */
public class RulebookCompiler {

    private static final Logger log = LoggerFactory.getLogger(RulebookCompiler.class);

    private final CompilerSettings settings;
    private final DependencyResolver resolver = new DependencyResolver();
    private final JavaCodeGenerator codeGenerator = new JavaCodeGenerator();
    private final GraphExporter graphExporter = new GraphExporter();
    private final EntitySourceGenerator sourceGenerator;
    private final RecordEvaluator recordEvaluator;

    public RulebookCompiler(CompilerSettings settings) {
        this.settings = settings;
        this.sourceGenerator = new EntitySourceGenerator(settings.generatedPackage(), settings.blankStringsAsNull());
        this.recordEvaluator = new RecordEvaluator(new ReferenceEvaluator(), settings.blankStringsAsNull());
    }

    public RulebookCompiler() {
        this(CompilerSettings.defaults());
    }

    public CompilerSettings getSettings() {
        return settings;
    }

    /**
     * Compile every entity of a rulebook.
     *
     * @throws RulebookException if compilation is interrupted
     */
    public CompilationResult compile(Rulebook rulebook) {
        long start = System.currentTimeMillis();
        int threads = Math.max(1, Math.min(settings.parallelism(), rulebook.entities().size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, new CompilerThreadFactory());

        try {
            Map<String, Future<CompiledEntity>> futures = new LinkedHashMap<>();
            for (EntitySchema entity : rulebook.entities()) {
                futures.put(entity.name(), executor.submit(() -> compileEntity(entity)));
            }

            Map<String, CompiledEntity> entities = new LinkedHashMap<>();
            for (Map.Entry<String, Future<CompiledEntity>> entry : futures.entrySet()) {
                entities.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }

            CompilationResult result = new CompilationResult(rulebook, entities);
            log.info("Compiled rulebook {}: {} entities, {} errors, {} cycles in {} ms",
                    rulebook.name(), entities.size(), result.errors().size(), result.cycles().size(),
                    System.currentTimeMillis() - start);
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Compile one entity. Dependency resolution completes before any source or graph is generated.
     */
    public CompiledEntity compileEntity(EntitySchema entity) {
        Map<String, FieldResult<FormulaNode>> asts = new LinkedHashMap<>();
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Field field : entity.calculatedFields()) {
            FieldResult<FormulaNode> ast = FieldResult.attempt(field.name(), () -> Formulas.parse(field.formula()));
            ast.getError().ifPresent(error -> log.warn("Failed to parse formula for {}.{}: {}",
                    entity.name(), field.name(), error.message()));
            asts.put(field.name(), ast);
            dependencies.put(field.name(), ast.getValue()
                    .<Set<String>>map(DependencyCollector::fieldDependencies)
                    .orElse(Set.of()));
        }

        LevelAssignment levels = resolver.resolve(entity.name(), entity.calculatedFields(),
                entity.rawFieldNames(), dependencies);
        Map<String, String> methodNames = EntitySourceGenerator.methodNames(levels);

        Map<String, CompiledField> fields = new LinkedHashMap<>();
        Map<String, FieldResult<GeneratedFunction>> functions = new LinkedHashMap<>();
        for (List<Field> level : levels.levels()) {
            for (Field field : level) {
                FieldResult<FormulaNode> ast = asts.get(field.name());
                List<String> dependencyOrder = levels.dependencyOrder(field.name());

                FieldResult<GeneratedFunction> function = ast.then(node -> codeGenerator.generate(entity.name(),
                        field.name(), node, dependencyOrder, field.formula(), methodNames.get(field.name())));
                FieldResult<ProvenanceGraph> graph = ast.then(node ->
                        graphExporter.export(node, field.name(), field.formula()));
                function.getError()
                        .filter(error -> ast.isSuccess())
                        .ifPresent(error -> log.warn("Failed to generate {}.{}: {}",
                                entity.name(), field.name(), error.message()));

                functions.put(field.name(), function);
                fields.put(field.name(), new CompiledField(field, levels.levelOf(field.name()), ast,
                        dependencyOrder, function, graph));
            }
        }

        String source = sourceGenerator.generate(entity, levels, functions);
        log.debug("Compiled entity {}: {} calculated fields in {} levels",
                entity.name(), fields.size(), levels.levels().size());
        return new CompiledEntity(entity, levels, fields, sourceGenerator.qualifiedClassName(entity.name()), source);
    }

    /**
     * Compute every calculated field of a record with the reference evaluator.
     */
    public EvaluatedRecord evaluate(CompiledEntity entity, FieldRecord record) {
        return recordEvaluator.evaluate(entity.levels(), entity.formulas(), record);
    }

    private static CompiledEntity await(String entityName, Future<CompiledEntity> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RulebookException("Interrupted while compiling entity " + entityName, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RulebookException("Failed to compile entity " + entityName, e.getCause());
        }
    }

    private static final class CompilerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_COUNT = new AtomicInteger();

        private final int pool = POOL_COUNT.incrementAndGet();
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "rulebook-compiler-" + pool + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
