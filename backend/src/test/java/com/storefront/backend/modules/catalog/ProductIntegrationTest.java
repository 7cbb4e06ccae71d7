package com.storefront.backend.modules.catalog;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.support.AbstractPostgresIntegrationTest;
import com.storefront.backend.support.AuthTestClient;
import com.storefront.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ProductIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String BOOKS = "00000000-0000-0000-0000-00000000c002";
    private static final String HOME = "00000000-0000-0000-0000-00000000c003";
    private static final String ARCHIVED = "00000000-0000-0000-0000-00000000c004";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void anonymousCallerCanBrowseButNotCreate() throws Exception {
        mockMvc.perform(get("/products"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(0))
                .andExpect(jsonPath("$.size").value(20));

        mockMvc.perform(post("/products").contentType(MediaType.APPLICATION_JSON).content(createBody(BOOKS)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("NOT_AUTHENTICATED"));
    }

    @Test
    void buyerCannotCreateProduct() throws Exception {
        String buyer = bearerFor(testUserFactory.createBuyer());

        mockMvc.perform(
                        post("/products")
                                .header("Authorization", buyer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(createBody(BOOKS))
                )
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_SELLER"));
    }

    @Test
    void sellerCreatesAndUpdatesOwnProduct() throws Exception {
        StoreUser seller = testUserFactory.createSeller();
        String bearer = bearerFor(seller);

        String productId = createProduct(bearer);

        mockMvc.perform(
                        patch("/products/{id}", productId)
                                .header("Authorization", bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "stock": 11,
                                          "categoryId": "%s"
                                        }
                                        """.formatted(HOME))
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stock").value(11))
                .andExpect(jsonPath("$.name").value("Field guide"))
                .andExpect(jsonPath("$.category.id").value(HOME))
                .andExpect(jsonPath("$.sellerId").value(seller.getId().toString()));

        mockMvc.perform(
                        put("/products/{id}", productId)
                                .header("Authorization", bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "name": "Field guide, 2nd edition"
                                        }
                                        """)
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Field guide, 2nd edition"))
                .andExpect(jsonPath("$.stock").value(11));
    }

    @Test
    void anotherSellerCannotUpdateTheProduct() throws Exception {
        String owner = bearerFor(testUserFactory.createSeller());
        String intruder = bearerFor(testUserFactory.createSeller());
        String productId = createProduct(owner);

        mockMvc.perform(
                        put("/products/{id}", productId)
                                .header("Authorization", intruder)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "price": 1.00
                                        }
                                        """)
                )
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_OWNER"));

        mockMvc.perform(get("/products/{id}", productId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(12.5));
    }

    @Test
    void missingProductIsOnlyRevealedToSellers() throws Exception {
        UUID missing = UUID.randomUUID();
        String body = """
                {
                  "stock": 1
                }
                """;

        mockMvc.perform(put("/products/{id}", missing).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(
                        put("/products/{id}", missing)
                                .header("Authorization", bearerFor(testUserFactory.createBuyer()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body)
                )
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_SELLER"));

        mockMvc.perform(
                        put("/products/{id}", missing)
                                .header("Authorization", bearerFor(testUserFactory.createSeller()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body)
                )
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PRODUCT_NOT_FOUND"));
    }

    @Test
    void blankNameInUpdateIsUnprocessable() throws Exception {
        String bearer = bearerFor(testUserFactory.createSeller());
        String productId = createProduct(bearer);

        mockMvc.perform(
                        patch("/products/{id}", productId)
                                .header("Authorization", bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "name": "   "
                                        }
                                        """)
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));

        mockMvc.perform(get("/products/{id}", productId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Field guide"));
    }

    @Test
    void deactivatedSellerCannotUpdateWithStillValidToken() throws Exception {
        StoreUser seller = testUserFactory.createSeller();
        String bearer = bearerFor(seller);
        String productId = createProduct(bearer);
        testUserFactory.deactivate(seller);

        mockMvc.perform(
                        put("/products/{id}", productId)
                                .header("Authorization", bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "price": 1.00
                                        }
                                        """)
                )
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("USER_INACTIVE"));

        mockMvc.perform(get("/products/{id}", productId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(12.5));
    }

    @Test
    void productInInactiveCategoryCannotBeCreated() throws Exception {
        mockMvc.perform(
                        post("/products")
                                .header("Authorization", bearerFor(testUserFactory.createSeller()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(createBody(ARCHIVED))
                )
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CATEGORY_NOT_FOUND"));
    }

    @Test
    void invalidProductIsUnprocessable() throws Exception {
        mockMvc.perform(
                        post("/products")
                                .header("Authorization", bearerFor(testUserFactory.createSeller()))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "name": "Broken",
                                          "price": -3,
                                          "stock": 1,
                                          "categoryId": "%s"
                                        }
                                        """.formatted(BOOKS))
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    private String createProduct(String bearer) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/products")
                                .header("Authorization", bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(createBody(BOOKS))
                )
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.category.id").value(BOOKS))
                .andReturn();
        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        return created.path("id").asText();
    }

    private String bearerFor(StoreUser user) throws Exception {
        return AuthTestClient.bearer(AuthTestClient.login(mockMvc, objectMapper, user.getEmail(), TestUserFactory.PASSWORD));
    }

    private static String createBody(String categoryId) {
        return """
                {
                  "name": "Field guide",
                  "description": "Birds of the coast",
                  "price": 12.50,
                  "stock": 4,
                  "categoryId": "%s"
                }
                """.formatted(categoryId);
    }
}
