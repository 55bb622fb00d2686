package com.polydoc.compiler;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;

/**
 * File manager keeping compiled snippet classes in memory, and the class loader that defines them.
 * All snippets of one session share the loader, so later snippets can see earlier ones' classes.
 */
class SnippetClassStore extends ForwardingJavaFileManager<StandardJavaFileManager> {
  private final Map<String, ClassOutput> classes = new ConcurrentHashMap<>();
  private final ClassLoader loader;

  SnippetClassStore(StandardJavaFileManager standardManager, ClassLoader parent) {
    super(standardManager);
    this.loader = new StoreClassLoader(parent);
  }

  ClassLoader loader() {
    return loader;
  }

  static JavaFileObject source(SnippetSource snippet) {
    return new SimpleJavaFileObject(
        URI.create("string:///" + snippet.className() + JavaFileObject.Kind.SOURCE.extension),
        JavaFileObject.Kind.SOURCE) {
      @Override
      public CharSequence getCharContent(boolean ignoreEncodingErrors) {
        return snippet.code();
      }
    };
  }

  @Override
  public JavaFileObject getJavaFileForOutput(
      Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
    ClassOutput output = new ClassOutput(className, kind);
    classes.put(className, output);
    return output;
  }

  private static final class ClassOutput extends SimpleJavaFileObject {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    ClassOutput(String className, Kind kind) {
      super(URI.create("mem:///" + className.replace('.', '/') + kind.extension), kind);
    }

    @Override
    public OutputStream openOutputStream() {
      return bytes;
    }
  }

  private final class StoreClassLoader extends ClassLoader {
    StoreClassLoader(ClassLoader parent) {
      super(parent);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
      ClassOutput output = classes.get(name);
      if (output == null) {
        return super.findClass(name);
      }
      byte[] b = output.bytes.toByteArray();
      return defineClass(name, b, 0, b.length);
    }
  }
}
