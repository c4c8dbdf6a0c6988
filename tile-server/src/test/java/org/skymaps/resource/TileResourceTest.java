package org.skymaps.resource;

import org.skymaps.TileServerFixture;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TileResourceTest {

  private TileServerFixture fixture;
  private MockMvc mvc;

  @Before
  public void setUp() {
    fixture = new TileServerFixture(TileServerFixture.demoLayer(), TileServerFixture.missingLayer("gone"));
    mvc = MockMvcBuilders
      .standaloneSetup(
        new TileResource(fixture.tileService),
        new LayerResource(fixture.registry, fixture.addressing),
        new HistogramResource(fixture.histogramService, fixture.renderer))
      .setControllerAdvice(new ErrorHandler())
      .build();
  }

  @After
  public void tearDown() {
    fixture.close();
  }

  @Test
  public void testTile() throws Exception {
    mvc.perform(get("/maps/demo/1/1/0.png").param("cmap", "magma"))
      .andExpect(status().isOk())
      .andExpect(content().contentType(MediaType.IMAGE_PNG))
      .andExpect(header().string(HttpHeaders.ETAG, startsWith("W/\"")))
      .andExpect(header().string("Access-Control-Allow-Origin", "*"));

    mvc.perform(get("/maps/demo/0/0/0.jpg"))
      .andExpect(status().isOk())
      .andExpect(content().contentType(MediaType.IMAGE_JPEG));
  }

  @Test
  public void testNotFound() throws Exception {
    mvc.perform(get("/maps/nope/0/0/0.png"))
      .andExpect(status().isNotFound())
      .andExpect(content().string(containsString("nope")));
    mvc.perform(get("/maps/demo/4/0/0.png"))
      .andExpect(status().isNotFound());
    mvc.perform(get("/maps/demo/0/1/0.png"))
      .andExpect(status().isNotFound());
  }

  @Test
  public void testBadRequest() throws Exception {
    mvc.perform(get("/maps/demo/0/0/0.png").param("vmin", "0").param("log_norm", "true"))
      .andExpect(status().isBadRequest());
    mvc.perform(get("/maps/demo/0/0/0.png").param("vmin", "5").param("vmax", "1"))
      .andExpect(status().isBadRequest());
    mvc.perform(get("/maps/demo/0/0/0.png").param("cmap", "rainbow"))
      .andExpect(status().isBadRequest());
    mvc.perform(get("/maps/demo/0/0/0.png").param("vmin", "low"))
      .andExpect(status().isBadRequest());
    mvc.perform(get("/maps/demo/0/0/0.gif"))
      .andExpect(status().isBadRequest());
  }

  @Test
  public void testServerError() throws Exception {
    mvc.perform(get("/maps/gone/0/0/0.png"))
      .andExpect(status().isInternalServerError())
      .andExpect(content().string(containsString("\"message\":\"Data unavailable for layer gone\"")));
    mvc.perform(get("/histograms/data/gone"))
      .andExpect(status().isInternalServerError())
      .andExpect(content().string(containsString("gone")));
  }

  @Test
  public void testAbsoluteValue() throws Exception {
    mvc.perform(get("/maps/demo/0/0/0.png").param("abs", "true"))
      .andExpect(status().isOk())
      .andExpect(content().contentType(MediaType.IMAGE_PNG));
    mvc.perform(get("/maps/demo/0/0/0.png").param("abs", "maybe"))
      .andExpect(status().isBadRequest());
  }

  @Test
  public void testLayers() throws Exception {
    mvc.perform(get("/maps"))
      .andExpect(status().isOk())
      .andExpect(content().string(containsString("\"layer_id\":\"demo\"")))
      .andExpect(content().string(containsString("\"max_zoom\":3")));
    mvc.perform(get("/maps/demo"))
      .andExpect(status().isOk())
      .andExpect(content().string(containsString("\"cmap\":\"viridis\"")));
  }

  @Test
  public void testHistogram() throws Exception {
    mvc.perform(get("/histograms/data/demo"))
      .andExpect(status().isOk())
      .andExpect(content().string(containsString("\"histogram\":[")))
      .andExpect(content().string(containsString("\"layer_id\":\"demo\"")));
    mvc.perform(get("/histograms/data/nope"))
      .andExpect(status().isNotFound());
  }

  @Test
  public void testColorbar() throws Exception {
    mvc.perform(get("/histograms/viridis_r.png"))
      .andExpect(status().isOk())
      .andExpect(content().contentType(MediaType.IMAGE_PNG));
    mvc.perform(get("/histograms/rainbow.png"))
      .andExpect(status().isBadRequest());
  }
}
