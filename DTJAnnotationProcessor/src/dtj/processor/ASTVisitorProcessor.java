package dtj.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates, for every {@link ASTNode} class, a {@code <Outer>_<Name>_ASTNode} interface with
 * double-dispatch and child traversal methods, and in the same round the {@code ASTVisitor},
 * {@code DefaultASTVisitor} and {@code ASTFunction} types covering the full node set.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  static final String PACKAGE = "dtj";

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  private final Set<String> allAstNodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      // All node classes arrive in one round; the visitors have to exist before ASTNodeInterface
      // and the node interfaces are attributed.
      if (!roundEnv.processingOver() && !annotations.isEmpty()) {
        processImpl(roundEnv);
        generateASTVisitorFiles();
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allAstNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateASTVisitorFiles() throws IOException {
    if (visitorsWritten || allAstNodes.isEmpty()) return;
    visitorsWritten = true;

    writeFile(
        "ASTVisitor",
        "package " + PACKAGE + ";\n\npublic interface ASTVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultASTVisitor",
        "package "
            + PACKAGE
            + ";\n\n"
            + "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n"
            + "  protected V visitNode(ASTNodeInterface node, V value) {\n"
            + "    return node.visitChildren(this, value);\n"
            + "  }\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return visitNode(node, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "ASTFunction",
        "package " + PACKAGE + ";\n\npublic interface ASTFunction<R> {\n\n%s\n\n}\n",
        typeName -> String.format("  R apply(%s node);", typeName));
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName AST_FUNCTION_NAME = ClassName.get(PACKAGE, "ASTFunction");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeVariableName R = TypeVariableName.get("R");

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeClassName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    String qualifiedName = element.getQualifiedName().toString();
    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE_NAME);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement("return visitor.visit(($L) this, value)", qualifiedName)
            .build());

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("apply")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(R)
            .returns(R)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(AST_FUNCTION_NAME, R), "function")
                    .build())
            .addStatement("return function.apply(($L) this)", qualifiedName)
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      // Child accessors return lists of nodes.
      visitChildrenMethodBuilder
          .beginControlFlow(
              "for ($T child : $L())", AST_NODE_INTERFACE_NAME, method.getSimpleName().toString())
          .addStatement("value = child.accept(visitor, value)")
          .endControlFlow();
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(PACKAGE, typeSpecBuilder.build()).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeASTNodeFile(typeElement);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      allAstNodes.add(typeElement.getQualifiedName().toString());
    }
  }
}
