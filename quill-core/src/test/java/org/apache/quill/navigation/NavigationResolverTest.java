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
package org.apache.quill.navigation;

import static org.apache.quill.DocumentFixtures.GET_PETS;
import static org.apache.quill.DocumentFixtures.INFO;
import static org.apache.quill.DocumentFixtures.PET;
import static org.apache.quill.DocumentFixtures.PETS;
import static org.apache.quill.DocumentFixtures.PET_NAME;
import static org.apache.quill.DocumentFixtures.RESPONSE_200;
import static org.apache.quill.DocumentFixtures.RESPONSE_SCHEMA;
import static org.apache.quill.DocumentFixtures.RESPONSE_SCHEMA_ITEMS;
import static org.apache.quill.DocumentFixtures.createPetstore;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.apache.quill.api.Node;
import org.apache.quill.api.NodeKind;
import org.apache.quill.commons.NodePath;
import org.apache.quill.model.MemoryDocument;
import org.junit.Before;
import org.junit.Test;

public class NavigationResolverTest {

    private final NavigationResolver resolver = new NavigationResolver();

    private MemoryDocument document;

    @Before
    public void setUp() {
        document = createPetstore();
    }

    private NavigationObject navigate(NodePath path) {
        return resolver.resolveNavigationObject(document.resolve(path), document);
    }

    @Test
    public void root() {
        NavigationObject navigation = resolver.resolveNavigationObject(document, document);
        assertSame(document, navigation.getObject());
        assertEquals("info", navigation.getType());
    }

    @Test
    public void nearestAncestorWins() {
        NavigationObject navigation = navigate(RESPONSE_SCHEMA_ITEMS);
        assertSame(document.resolve(RESPONSE_SCHEMA), navigation.getObject());
        assertEquals("schema", navigation.getType());
    }

    @Test
    public void nodeIsItsOwnNavigationObject() {
        assertSame(document.resolve(RESPONSE_200), navigate(RESPONSE_200).getObject());
        assertEquals("response", navigate(RESPONSE_200).getType());
        assertEquals("pathItem", navigate(PETS).getType());
    }

    @Test
    public void operationNavigatesToPathItem() {
        NavigationObject navigation = navigate(GET_PETS);
        assertSame(document.resolve(PETS), navigation.getObject());
        assertEquals("pathItem", navigation.getType());
    }

    @Test
    public void schemaProperty() {
        NavigationObject navigation = navigate(PET_NAME);
        assertSame(document.resolve(PET), navigation.getObject());
        assertEquals(new NavigationObject(document.resolve(PET), "schema"), navigation);
    }

    @Test
    public void fallbackToRoot() {
        NavigationObject navigation = navigate(INFO);
        assertSame(document, navigation.getObject());
        assertEquals(NavigationResolver.ROOT_NAVIGATION_TYPE, navigation.getType());
    }

    @Test
    public void additionalKinds() {
        NavigationResolver withOperations = NavigationResolver.withAdditionalKinds(NodeKind.OPERATION);
        NavigationObject navigation = withOperations.resolveNavigationObject(
                document.resolve(RESPONSE_200.getParent()), document);
        assertSame(document.resolve(GET_PETS), navigation.getObject());
        assertEquals("operation", navigation.getType());
    }

    @Test(expected = IllegalArgumentException.class)
    public void documentIsNotConfigurable() {
        NavigationResolver.withAdditionalKinds(NodeKind.DOCUMENT);
    }

    @Test
    public void nearestExisting() {
        Node operation = document.resolve(GET_PETS);
        assertSame(operation, resolver.resolveNearestExisting(
                GET_PETS.append("parameters").append("0"), document));
        assertSame(operation, resolver.resolveNearestExisting(GET_PETS, document));
        assertSame(document, resolver.resolveNearestExisting(NodePath.of("webhooks", "newPet"), document));
        assertSame(document, resolver.resolveNearestExisting(NodePath.ROOT, document));
    }

    @Test
    public void nearestOperation() {
        Node operation = document.resolve(GET_PETS);
        assertSame(operation, resolver.resolveNearestOperation(RESPONSE_SCHEMA_ITEMS, document));
        assertSame(operation, resolver.resolveNearestOperation(
                GET_PETS.append("requestBody").append("content"), document));
        assertNull(resolver.resolveNearestOperation(PETS, document));
        assertNull(resolver.resolveNearestOperation(PETS.append("post").append("responses"), document));
        assertNull(resolver.resolveNearestOperation(PET_NAME, document));
    }
}
