package dtj.processor;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class ASTVisitorProcessorTest {

  @TempDir File tempDir;

  private static final String NODE_INTERFACE =
      Joiner.on('\n')
          .join(
              "package dtj;",
              "public interface ASTNodeInterface {",
              "  <V> V accept(ASTVisitor<V> visitor, V value);",
              "  <V> V visitChildren(ASTVisitor<V> visitor, V value);",
              "  <R> R apply(ASTFunction<R> function);",
              "}");

  private static final String TREE =
      Joiner.on('\n')
          .join(
              "package dtj;",
              "import java.util.List;",
              "import dtj.processor.ASTChild;",
              "import dtj.processor.ASTNode;",
              "public class Tree {",
              "  @ASTNode",
              "  public static class Leaf implements Tree_Leaf_ASTNode {}",
              "  @ASTNode",
              "  public static class Branch implements Tree_Branch_ASTNode {",
              "    @ASTChild",
              "    @Override",
              "    public List<Leaf> leaves() {",
              "      return List.of(new Leaf(), new Leaf());",
              "    }",
              "  }",
              "  public static int count(ASTNodeInterface node) {",
              "    return node.accept(new DefaultASTVisitor<Integer>() {",
              "      @Override",
              "      protected Integer visitNode(ASTNodeInterface n, Integer value) {",
              "        return super.visitNode(n, value + 1);",
              "      }",
              "    }, 0);",
              "  }",
              "  public static String kind(ASTNodeInterface node) {",
              "    return node.apply(new ASTFunction<String>() {",
              "      public String apply(Leaf leaf) { return \"leaf\"; }",
              "      public String apply(Branch branch) { return \"branch\"; }",
              "    });",
              "  }",
              "}");

  private File writeSource(File sourceDir, String name, String content) throws IOException {
    File file = new File(sourceDir, "dtj/" + name + ".java");
    Files.createParentDirs(file);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }

  private static String classpathOf(Class<?> clazz) throws Exception {
    return new File(clazz.getProtectionDomain().getCodeSource().getLocation().toURI()).getPath();
  }

  @Test
  public void cleanBuildCompilesInOnePass() throws Exception {
    File sourceDir = new File(tempDir, "src");
    File generatedDir = new File(tempDir, "generated");
    File classesDir = new File(tempDir, "classes");
    generatedDir.mkdirs();
    classesDir.mkdirs();
    List<File> sources =
        ImmutableList.of(
            writeSource(sourceDir, "ASTNodeInterface", NODE_INTERFACE),
            writeSource(sourceDir, "Tree", TREE));

    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    boolean compiled;
    try (StandardJavaFileManager fileManager =
        compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
      JavaCompiler.CompilationTask task =
          compiler.getTask(
              null,
              fileManager,
              diagnostics,
              ImmutableList.of(
                  "-classpath", classpathOf(ASTNode.class),
                  "-d", classesDir.getPath(),
                  "-s", generatedDir.getPath()),
              null,
              fileManager.getJavaFileObjectsFromFiles(sources));
      task.setProcessors(ImmutableList.of(new ASTVisitorProcessor()));
      compiled = task.call();
    }

    assertThat(diagnostics.getDiagnostics().toString()).doesNotContain("cannot find symbol");
    assertThat(compiled).isTrue();
    assertThat(new File(generatedDir, "dtj/ASTVisitor.java").isFile()).isTrue();
    assertThat(new File(generatedDir, "dtj/Tree_Branch_ASTNode.java").isFile()).isTrue();

    try (URLClassLoader loader =
        new URLClassLoader(
            new URL[] {classesDir.toURI().toURL()}, getClass().getClassLoader())) {
      Class<?> tree = loader.loadClass("dtj.Tree");
      Class<?> nodeInterface = loader.loadClass("dtj.ASTNodeInterface");
      Object branch = loader.loadClass("dtj.Tree$Branch").getConstructor().newInstance();

      Method count = tree.getMethod("count", nodeInterface);
      Method kind = tree.getMethod("kind", nodeInterface);
      assertThat(count.invoke(null, branch)).isEqualTo(3);
      assertThat(kind.invoke(null, branch)).isEqualTo("branch");
    }
  }
}
