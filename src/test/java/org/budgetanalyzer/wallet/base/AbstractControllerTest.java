package org.budgetanalyzer.wallet.base;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base class for controller tests with MockMvc.
 *
 * <p>Subclasses declare the slice ({@code @WebMvcTest}) and mock the services the controller
 * under test depends on. The helpers send JSON and return {@link ResultActions} for chaining.
 *
 * <p><b>Usage:</b>
 *
 * <pre>{@code
 * @WebMvcTest(CurrencyController.class)
 * class CurrencyControllerTest extends AbstractControllerTest {
 *
 *     @MockBean private ExchangeRateService exchangeRateService;
 *
 *     @Test
 *     void shouldReturnRates() throws Exception {
 *         performGet("/v1/exchange-rates/{base}", "USD")
 *             .andExpect(status().isOk());
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractControllerTest {

  @Autowired protected MockMvc mockMvc;

  @Autowired protected ObjectMapper objectMapper;

  /**
   * Performs GET request.
   *
   * @param urlTemplate URL template with optional path variables
   * @param uriVars path variable values
   * @return ResultActions for chaining assertions
   * @throws Exception if request fails
   */
  protected ResultActions performGet(String urlTemplate, Object... uriVars) throws Exception {
    return mockMvc.perform(get(urlTemplate, uriVars).accept(MediaType.APPLICATION_JSON));
  }

  /**
   * Performs POST request with JSON body.
   *
   * @param urlTemplate URL template with optional path variables
   * @param jsonBody JSON request body
   * @return ResultActions for chaining assertions
   * @throws Exception if request fails
   */
  protected ResultActions performPost(String urlTemplate, String jsonBody) throws Exception {
    return mockMvc.perform(
        post(urlTemplate)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .content(jsonBody));
  }

  /**
   * Performs POST request, serializing {@code body} with the application ObjectMapper.
   *
   * @param urlTemplate URL template with optional path variables
   * @param body request object
   * @return ResultActions for chaining assertions
   * @throws Exception if request fails
   */
  protected ResultActions performPost(String urlTemplate, Object body) throws Exception {
    return performPost(urlTemplate, objectMapper.writeValueAsString(body));
  }

  /**
   * Performs DELETE request.
   *
   * @param urlTemplate URL template with optional path variables
   * @param uriVars path variable values
   * @return ResultActions for chaining assertions
   * @throws Exception if request fails
   */
  protected ResultActions performDelete(String urlTemplate, Object... uriVars) throws Exception {
    return mockMvc.perform(delete(urlTemplate, uriVars));
  }
}
