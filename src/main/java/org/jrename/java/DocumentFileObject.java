package org.jrename.java;

import java.net.URI;
import java.net.URISyntaxException;
import javax.tools.SimpleJavaFileObject;
import org.jrename.workspace.Document;

/** Hands the text of a document in a snapshot to javac. Nothing is read from disk. */
class DocumentFileObject extends SimpleJavaFileObject {
    final Document document;

    DocumentFileObject(Document document) {
        super(uri(document), Kind.SOURCE);
        this.document = document;
    }

    static URI uri(Document document) {
        try {
            return new URI("mem", null, "/" + document.projectId().name + "/" + document.name, null);
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
        return document.text;
    }

    @Override
    public boolean isNameCompatible(String simpleName, Kind kind) {
        return document.fileName().equals(simpleName + kind.extension);
    }
}
