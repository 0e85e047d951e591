/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quill;

import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.apache.quill.model.MemoryDocument;

/**
 * Documents shared by the tests.
 */
public final class DocumentFixtures {

    public static final NodePath INFO = NodePath.of("info");

    public static final NodePath PETS = NodePath.of("paths", "/pets");

    public static final NodePath GET_PETS = PETS.append("get");

    public static final NodePath RESPONSE_200 = GET_PETS.append("responses").append("200");

    public static final NodePath RESPONSE_SCHEMA = RESPONSE_200
            .append("content").append("application/json").append("schema");

    public static final NodePath RESPONSE_SCHEMA_ITEMS = RESPONSE_SCHEMA.append("items");

    public static final NodePath PET = NodePath.of("components", "schemas", "Pet");

    public static final NodePath PET_NAME = PET.append("properties").append("name");

    private DocumentFixtures() {
    }

    /**
     * <pre>
     * /info                                         info       title=Petstore
     * /paths/~1pets                                 pathItem
     * /paths/~1pets/get                             operation  summary=List pets
     * /paths/~1pets/get/responses/200               response   description=OK
     * .../200/content/application~1json/schema      schema     type=array
     * .../schema/items                              node       $ref=#/components/schemas/Pet
     * /components/schemas/Pet                       schema     type=object
     * /components/schemas/Pet/properties/name       node       type=string
     * </pre>
     */
    public static MemoryDocument createPetstore() {
        MemoryDocument document = new MemoryDocument();
        document.setProperty("openapi", "3.0.2");
        document.addChild("info", NodeKind.INFO).setProperty("title", "Petstore");

        Node operation = document.addChild("paths", NodeKind.PATHS)
                .addChild("/pets", NodeKind.PATH_ITEM)
                .addChild("get", NodeKind.OPERATION);
        operation.setProperty("summary", "List pets");
        Node response = operation.addChild("responses", NodeKind.RESPONSES)
                .addChild("200", NodeKind.RESPONSE);
        response.setProperty("description", "OK");
        Node schema = response.addChild("content", NodeKind.GENERIC)
                .addChild("application/json", NodeKind.MEDIA_TYPE)
                .addChild("schema", NodeKind.SCHEMA);
        schema.setProperty("type", "array");
        schema.addChild("items", NodeKind.GENERIC).setProperty("$ref", "#/components/schemas/Pet");

        Node pet = document.addChild("components", NodeKind.COMPONENTS)
                .addChild("schemas", NodeKind.GENERIC)
                .addChild("Pet", NodeKind.SCHEMA);
        pet.setProperty("type", "object");
        pet.addChild("properties", NodeKind.GENERIC)
                .addChild("name", NodeKind.GENERIC)
                .setProperty("type", "string");
        return document;
    }
}
